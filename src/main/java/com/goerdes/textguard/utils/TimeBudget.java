package com.goerdes.textguard.utils;

import java.time.Duration;

/**
 * Wall-clock budget of a single request, checked cooperatively before each expensive step.
 */
public class TimeBudget {

    private final long deadlineNanos;

    public TimeBudget(Duration total) {
        this.deadlineNanos = System.nanoTime() + total.toNanos();
    }

    public long remainingMs() {
        return Math.max(0, (deadlineNanos - System.nanoTime()) / 1_000_000L);
    }

    public boolean exhausted() {
        return deadlineNanos - System.nanoTime() <= 0;
    }
}

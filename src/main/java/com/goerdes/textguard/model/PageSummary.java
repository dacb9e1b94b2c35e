package com.goerdes.textguard.model;

import java.time.Instant;

/**
 * Metadata of a stored page without its text.
 */
public record PageSummary(
        Long id,
        String label,
        String url,
        String domain,
        PageOrigin origin,
        int wordCount,
        Instant fetchedAt
) {}

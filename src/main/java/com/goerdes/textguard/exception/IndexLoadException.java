package com.goerdes.textguard.exception;

/**
 * Thrown when a persisted index snapshot exists but cannot be loaded
 * (bad magic, unknown format version, checksum mismatch, truncated data or a
 * seed table that differs from the running configuration).
 * <p>
 * Startup must halt on this exception; the snapshot is never silently discarded.
 */
public class IndexLoadException extends RuntimeException {

    public IndexLoadException(String message) {
        super(message);
    }

    public IndexLoadException(String message, Throwable cause) {
        super(message, cause);
    }

}

package com.goerdes.textguard.model;

/**
 * Outcome of visiting one candidate URL.
 *
 * @param url    the URL
 * @param status what happened
 * @param text   page text for {@link Status#CACHED} and {@link Status#FETCHED}, otherwise {@code null}
 * @param pageId the stored page id when the page is in the corpus, otherwise {@code null}
 * @param detail failure detail, may be {@code null}
 */
public record FetchOutcome(String url, Status status, String text, Long pageId, String detail) {

    public enum Status {
        /** Served from a fresh cache entry, no network call. */
        CACHED,
        /** Fetched, extracted and stored. */
        FETCHED,
        /** Disallowed by robots exclusion; not fetched, not cached. */
        BLOCKED,
        /** Network error, timeout or non-success response. */
        FAILED,
        /** Fetched but below the word floor; not stored. */
        TOO_SHORT,
        /** Not visited because the request budget ran out. */
        SKIPPED
    }

    public boolean hasText() {
        return status == Status.CACHED || status == Status.FETCHED;
    }

    public static FetchOutcome of(String url, Status status, String detail) {
        return new FetchOutcome(url, status, null, null, detail);
    }
}

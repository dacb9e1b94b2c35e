package com.goerdes.textguard.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Result of a check request: ranked matches plus the document-level plagiarism score.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class MatchReport {

    private final Long submissionId;

    private final Long reportId;

    /** Fraction of the query's shingles found in any accepted match (0.0–1.0). */
    private final double plagiarismScore;

    private final double plagiarismPercent;

    private final List<MatchResult> matches;

    /** Number of candidates scored, from the index and from the web. */
    private final int candidatesCount;

    private final int urlsFetched;

    private final int urlsBlocked;

    private final int urlsFailed;

    /** Set when the request budget ran out before every candidate URL was visited. */
    private final boolean partial;
}

package com.goerdes.textguard.model;

import java.util.List;

/**
 * Ranked matches and the document-level score of one query.
 *
 * @param matches         accepted matches, best first, truncated to top-k
 * @param plagiarismScore fraction of query shingles covered by any accepted match
 * @param candidatesCount number of candidates that were scored
 */
public record ScoringResult(List<MatchResult> matches, double plagiarismScore, int candidatesCount) {

    public static ScoringResult empty() {
        return new ScoringResult(List.of(), 0.0, 0);
    }

    public double plagiarismPercent() {
        return Math.round(plagiarismScore * 10_000.0) / 100.0;
    }
}

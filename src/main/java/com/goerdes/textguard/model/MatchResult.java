package com.goerdes.textguard.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One accepted candidate: exact Jaccard, optional semantic score, the blended score used for
 * ranking, and a derived rating category.
 */
@Getter
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MatchResult {

    public static final String HIGH = "high";
    public static final String MEDIUM = "medium";
    public static final String LOW = "low";

    /** Minimum score (inclusive) to qualify as a “high” similarity. */
    private static final double HIGH_THRESHOLD = 0.8;

    /** Maximum score (inclusive) to qualify as a “low” similarity. */
    private static final double LOW_THRESHOLD = 0.3;

    @Setter
    private Long docId;

    @Setter
    private String label;

    @Setter
    private String url;

    @Setter
    private PageOrigin origin;

    /** Exact Jaccard similarity of the shingle sets (0.0–1.0). */
    @Setter
    private double jaccard;

    /** Semantic similarity, absent when not computed. */
    @Setter
    private Double semantic;

    /** Number of query shingles found in this candidate. */
    @Setter
    private int matchedShingles;

    /** Ranking score: blended when a semantic score exists, otherwise the Jaccard value. */
    private double combinedScore;

    /** Combined score as a percentage, two decimals. */
    private double percent;

    /** Category corresponding to the combinedScore: HIGH, MEDIUM or LOW. */
    private String similarityRating;

    /**
     * Updates the combined score and recomputes percent and rating.
     *
     * @param combinedScore value between 0.0 and 1.0
     */
    public void setCombinedScore(double combinedScore) {
        this.combinedScore = combinedScore;
        this.percent = Math.round(combinedScore * 10_000.0) / 100.0;
        this.similarityRating = combinedScore >= HIGH_THRESHOLD ? HIGH : combinedScore <= LOW_THRESHOLD ? LOW : MEDIUM;
    }

}

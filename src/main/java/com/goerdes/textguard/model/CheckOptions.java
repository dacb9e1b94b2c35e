package com.goerdes.textguard.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-request options for a plagiarism check.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString
public class CheckOptions {

    /** Upper bound on the number of phrases sent to the search provider. */
    @Builder.Default
    private int maxPhrases = 5;

    /** Upper bound on the number of URLs crawled for this request. */
    @Builder.Default
    private int maxCandidateUrls = 10;

    /** Blend in the semantic collaborator when one is available. */
    @Builder.Default
    private boolean useSemantic = false;

    /** Number of ranked matches returned. */
    @Builder.Default
    private int topK = 5;

    @Builder.Default
    private String userRef = "anonymous";

    /** Run web discovery in addition to the local index lookup. */
    @Builder.Default
    private boolean webSearch = true;

    public static CheckOptions defaults() {
        return CheckOptions.builder().build();
    }
}

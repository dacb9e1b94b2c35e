package com.goerdes.textguard.components.semantic;

/**
 * Optional embedding-based similarity. When no bean implements this interface, scoring is
 * lexical only.
 */
public interface SemanticSimilarity {

    /**
     * @param textA first text window
     * @param textB second text window
     * @return similarity in [0, 1]
     */
    double similarity(String textA, String textB);

}

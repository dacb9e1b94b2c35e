package com.goerdes.textguard.model;

/**
 * Parameters that deterministically regenerate the MinHash permutations.
 *
 * @param seed         the random seed for the hash coefficients
 * @param permutations the sketch length
 * @param dictSize     the token dictionary size shingles are folded into
 */
public record SeedTable(long seed, int permutations, int dictSize) {

    public SeedTable {
        if (permutations <= 0) {
            throw new IllegalArgumentException("Permutation count must be positive: " + permutations);
        }
        if (dictSize <= 0) {
            throw new IllegalArgumentException("Dictionary size must be positive: " + dictSize);
        }
    }
}

package com.goerdes.textguard.components;

import com.goerdes.textguard.model.SeedTable;
import info.debatty.java.lsh.MinHash;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Set;

/**
 * Provides the process-wide MinHash instance with a fixed seed for consistent
 * sketch generation and similarity estimation across index and query.
 * <p>
 * The {@link SeedTable} regenerates the exact same permutation coefficients and is
 * persisted alongside the index snapshot.
 */
@Component
public class MinHashProvider {

    private static final Logger log = LoggerFactory.getLogger(MinHashProvider.class);

    public static final long DEFAULT_SEED = 123456789L;

    public static final int DEFAULT_PERMUTATIONS = 128;

    public static final int MINHASH_DICT_SIZE = 16_777_216;

    private final SeedTable seedTable;

    private final MinHash minhash;

    @Autowired
    public MinHashProvider(@Value("${textguard.minhash.permutations:128}") int permutations,
                           @Value("${textguard.minhash.seed:123456789}") long seed) {
        this(new SeedTable(seed, permutations, MINHASH_DICT_SIZE));
    }

    public MinHashProvider(SeedTable seedTable) {
        this.seedTable = seedTable;
        this.minhash = new MinHash(seedTable.permutations(), seedTable.dictSize(), seedTable.seed());
        log.info("MinHash initialised: {}", seedTable);
    }

    public MinHashProvider() {
        this(DEFAULT_PERMUTATIONS, DEFAULT_SEED);
    }

    public SeedTable seedTable() {
        return seedTable;
    }

    public int permutations() {
        return seedTable.permutations();
    }

    /**
     * Builds the sketch of a shingle set. The result only depends on the set's members,
     * never on iteration order. An empty set yields a sketch with every position at
     * {@link Integer#MAX_VALUE}.
     *
     * @param shingles the shingle set
     * @return the MinHash signature
     */
    public int[] sketch(Set<String> shingles) {
        return minhash.signature(mapShinglesToTokens(shingles));
    }

    /**
     * Fraction of equal positions between two sketches built from this seed table.
     */
    public double estimate(int[] a, int[] b) {
        return minhash.similarity(a, b);
    }

    /**
     * Returns {@code true} when the sketch was built from an empty shingle set.
     */
    public static boolean isEmptySketch(int[] sketch) {
        for (int v : sketch) {
            if (v != Integer.MAX_VALUE) {
                return false;
            }
        }
        return true;
    }

    /**
     * Maps each shingle to a token in [0, MINHASH_DICT_SIZE−1] using
     * floorMod(s.hashCode(), MINHASH_DICT_SIZE) and removes duplicates.
     *
     * @param shingles shingles to map
     * @return unique set of tokens
     */
    public static Set<Integer> mapShinglesToTokens(Set<String> shingles) {
        Set<Integer> tokenSet = new HashSet<>();
        for (String s : shingles) {
            tokenSet.add(Math.floorMod(s.hashCode(), MINHASH_DICT_SIZE));
        }
        return tokenSet;
    }
}

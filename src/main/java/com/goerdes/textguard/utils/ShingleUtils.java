package com.goerdes.textguard.utils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure text normalization helpers: tokenization, k-shingling and exact Jaccard similarity.
 * <p>
 * Tokens are maximal runs of {@code [a-z0-9]} after ASCII-only lower-casing; every other
 * character, including non-ASCII letters, acts as a separator. Tokens of length one are dropped.
 */
public final class ShingleUtils {

    private static final int MIN_TOKEN_LENGTH = 2;

    private ShingleUtils() {
    }

    /**
     * Splits the text into lower-cased alphanumeric tokens.
     *
     * @param text the input text, may be {@code null}
     * @return the token sequence, empty for blank input
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0, n = text.length(); i < n; i++) {
            char c = text.charAt(i);
            if (c >= 'A' && c <= 'Z') {
                sb.append((char) (c + ('a' - 'A')));
            } else if ((c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')) {
                sb.append(c);
            } else {
                flush(sb, tokens);
            }
        }
        flush(sb, tokens);
        return tokens;
    }

    private static void flush(StringBuilder sb, List<String> tokens) {
        if (sb.length() >= MIN_TOKEN_LENGTH) {
            tokens.add(sb.toString());
        }
        sb.setLength(0);
    }

    /**
     * Builds the set of space-joined k-token windows. A sequence of at most k tokens yields
     * a single shingle made of the whole sequence.
     *
     * @param tokens the token sequence
     * @param k      the window size, at least 1
     * @return the shingle set, empty only for an empty token sequence
     */
    public static Set<String> shingles(List<String> tokens, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("Shingle size must be positive: " + k);
        }
        Set<String> out = new HashSet<>();
        if (tokens.isEmpty()) {
            return out;
        }
        if (tokens.size() <= k) {
            out.add(String.join(" ", tokens));
            return out;
        }
        for (int i = 0; i + k <= tokens.size(); i++) {
            out.add(String.join(" ", tokens.subList(i, i + k)));
        }
        return out;
    }

    public static Set<String> shingles(String text, int k) {
        return shingles(tokenize(text), k);
    }

    /**
     * Computes |A ∩ B| / |A ∪ B|. Two empty sets are identical (1.0); an empty set against a
     * non-empty one scores 0.0.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        int inter = 0;
        for (String s : smaller) {
            if (larger.contains(s)) {
                inter++;
            }
        }
        int union = a.size() + b.size() - inter;
        return (double) inter / union;
    }

    /**
     * Returns the members of {@code query} that also occur in {@code other}.
     */
    public static Set<String> intersection(Set<String> query, Set<String> other) {
        Set<String> out = new HashSet<>(query);
        out.retainAll(other);
        return out;
    }

    /**
     * Joins {@code phraseWords} consecutive tokens starting at every {@code stride}-th token,
     * returning at most {@code maxPhrases} phrases.
     */
    public static List<String> phrases(List<String> tokens, int phraseWords, int maxPhrases) {
        List<String> out = new ArrayList<>();
        if (tokens.isEmpty() || maxPhrases <= 0) {
            return out;
        }
        int stride = Math.max(1, tokens.size() / maxPhrases);
        for (int i = 0; i < tokens.size() && out.size() < maxPhrases; i += stride) {
            int end = Math.min(tokens.size(), i + phraseWords);
            out.add(String.join(" ", tokens.subList(i, end)));
            if (end == tokens.size()) {
                break;
            }
        }
        return out;
    }
}

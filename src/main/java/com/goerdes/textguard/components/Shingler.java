package com.goerdes.textguard.components;

import com.goerdes.textguard.utils.ShingleUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * {@link ShingleUtils} bound to the configured shingle size, so index and query always agree.
 */
@Component
public class Shingler {

    private final int shingleSize;

    public Shingler(@Value("${textguard.shingle.size:5}") int shingleSize) {
        if (shingleSize < 1) {
            throw new IllegalArgumentException("textguard.shingle.size must be positive: " + shingleSize);
        }
        this.shingleSize = shingleSize;
    }

    public int shingleSize() {
        return shingleSize;
    }

    public List<String> tokens(String text) {
        return ShingleUtils.tokenize(text);
    }

    public Set<String> shingles(String text) {
        return ShingleUtils.shingles(ShingleUtils.tokenize(text), shingleSize);
    }

    public Set<String> shingles(List<String> tokens) {
        return ShingleUtils.shingles(tokens, shingleSize);
    }
}

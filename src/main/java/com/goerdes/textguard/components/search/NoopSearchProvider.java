package com.goerdes.textguard.components.search;

import java.util.List;

/**
 * Used when no search endpoint is configured.
 */
public class NoopSearchProvider implements SearchProvider {

    @Override
    public List<String> search(String query, int limit) {
        return List.of();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}

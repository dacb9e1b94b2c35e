package com.goerdes.textguard.components.search;

import java.util.List;

/**
 * External web search returning candidate URLs for a phrase query.
 * Implementations may block, fail or be slow; callers bound them with a deadline.
 */
public interface SearchProvider {

    /**
     * @param query the phrase to search for
     * @param limit the maximum number of URLs wanted
     * @return result URLs, best first
     */
    List<String> search(String query, int limit);

    /**
     * Whether this provider can return anything at all.
     */
    default boolean isEnabled() {
        return true;
    }

}

package com.goerdes.textguard.model;

/**
 * Where a stored page came from.
 */
public enum PageOrigin {
    /** Indexed explicitly through indexText/indexDocument. */
    LOCAL,

    /** Fetched by the crawler from a search result or seed URL. */
    WEB
}

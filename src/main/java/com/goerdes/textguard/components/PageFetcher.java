package com.goerdes.textguard.components;

import com.goerdes.textguard.model.FetchedPage;

import java.io.IOException;

/**
 * Performs bounded-timeout HTTP GET requests for the crawler.
 */
public interface PageFetcher {

    /**
     * Fetches the URL. Non-success statuses are returned, not thrown.
     *
     * @param url the absolute http(s) URL
     * @return the response
     * @throws IOException on connection failure or timeout
     */
    FetchedPage fetch(String url) throws IOException;

    /**
     * The user agent sent with every request and matched against robots.txt groups.
     */
    String userAgent();

}

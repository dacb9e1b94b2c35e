package com.goerdes.textguard.model;

/**
 * Raw HTTP response of a page fetch.
 *
 * @param url         the final URL after redirects
 * @param statusCode  the HTTP status
 * @param contentType the declared content type, may be {@code null}
 * @param body        the response body
 */
public record FetchedPage(String url, int statusCode, String contentType, byte[] body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    public boolean isHtml() {
        return contentType == null || contentType.contains("html") || contentType.contains("xml");
    }
}

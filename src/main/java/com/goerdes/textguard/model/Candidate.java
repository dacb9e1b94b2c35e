package com.goerdes.textguard.model;

/**
 * A document to re-score against the query.
 *
 * @param docId  the page id
 * @param label  display name (filename, title or URL)
 * @param url    the page URL
 * @param origin local corpus or web
 * @param text   the stored text used for exact scoring
 */
public record Candidate(Long docId, String label, String url, PageOrigin origin, String text) {}

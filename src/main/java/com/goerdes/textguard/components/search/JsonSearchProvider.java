package com.goerdes.textguard.components.search;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Search provider for JSON search endpoints in the SearxNG format:
 * {@code GET {baseUrl}/search?q=...&format=json} answering {@code {"results":[{"url":...}]}}.
 */
public class JsonSearchProvider implements SearchProvider {

    private static final Logger log = LoggerFactory.getLogger(JsonSearchProvider.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public JsonSearchProvider(RestTemplate restTemplate, ObjectMapper mapper, String baseUrl) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public List<String> search(String query, int limit) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/search")
                .queryParam("q", query)
                .queryParam("format", "json")
                .encode()
                .build()
                .toUri();
        String json = restTemplate.getForObject(uri, String.class);
        return parseUrls(json, limit);
    }

    List<String> parseUrls(String json, int limit) {
        List<String> urls = new ArrayList<>();
        if (json == null || json.isBlank()) {
            return urls;
        }
        try {
            JsonNode results = mapper.readTree(json).path("results");
            for (JsonNode result : results) {
                String url = result.path("url").asText("");
                if (url.startsWith("http://") || url.startsWith("https://")) {
                    urls.add(url);
                }
                if (urls.size() >= limit) {
                    break;
                }
            }
        } catch (JsonProcessingException e) {
            log.warn("Unparseable search response from {}: {}", baseUrl, e.getOriginalMessage());
        }
        return urls;
    }
}

package com.goerdes.textguard.utils;

import com.goerdes.textguard.components.search.SearchProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Returns the same configured URLs for every query.
 */
public class StubSearchProvider implements SearchProvider {

    private final List<String> results = new CopyOnWriteArrayList<>();
    private final List<String> queries = new CopyOnWriteArrayList<>();

    public void returning(String... urls) {
        results.clear();
        results.addAll(List.of(urls));
    }

    public List<String> queries() {
        return queries;
    }

    public void reset() {
        results.clear();
        queries.clear();
    }

    @Override
    public List<String> search(String query, int limit) {
        queries.add(query);
        List<String> out = new ArrayList<>(results);
        return out.size() > limit ? out.subList(0, limit) : out;
    }
}

package com.goerdes.textguard.utils;

import com.goerdes.textguard.components.PageFetcher;
import com.goerdes.textguard.model.FetchedPage;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * In-memory web: serves registered pages, 404 for everything else, and records every request.
 */
public class StubPageFetcher implements PageFetcher {

    private final Map<String, FetchedPage> pages = new ConcurrentHashMap<>();
    private final Map<String, IOException> failures = new ConcurrentHashMap<>();
    private final Map<String, Error> crashes = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
    private final List<String> requested = new CopyOnWriteArrayList<>();

    public void html(String url, String html) {
        pages.put(url, new FetchedPage(url, 200, "text/html; charset=utf-8", html.getBytes(UTF_8)));
    }

    public void text(String url, String contentType, String body) {
        pages.put(url, new FetchedPage(url, 200, contentType, body.getBytes(UTF_8)));
    }

    public void status(String url, int status) {
        pages.put(url, new FetchedPage(url, status, "text/html", new byte[0]));
    }

    public void fail(String url, IOException e) {
        failures.put(url, e);
    }

    /**
     * Makes requests for the URL wait until the gate opens.
     */
    public void hold(String url, CountDownLatch gate) {
        gates.put(url, gate);
    }

    public void crash(String url, Error error) {
        crashes.put(url, error);
    }

    public List<String> requested() {
        return requested;
    }

    public long requestCount(String url) {
        return requested.stream().filter(url::equals).count();
    }

    public void reset() {
        pages.clear();
        failures.clear();
        crashes.clear();
        gates.clear();
        requested.clear();
    }

    @Override
    public FetchedPage fetch(String url) throws IOException {
        requested.add(url);
        CountDownLatch gate = gates.get(url);
        if (gate != null) {
            try {
                if (!gate.await(10, TimeUnit.SECONDS)) {
                    throw new IOException("gate for " + url + " never opened");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
        }
        Error crash = crashes.get(url);
        if (crash != null) {
            throw crash;
        }
        IOException failure = failures.get(url);
        if (failure != null) {
            throw failure;
        }
        FetchedPage page = pages.get(url);
        return page != null ? page : new FetchedPage(url, 404, "text/html", new byte[0]);
    }

    @Override
    public String userAgent() {
        return "TextGuardBot/1.0";
    }
}

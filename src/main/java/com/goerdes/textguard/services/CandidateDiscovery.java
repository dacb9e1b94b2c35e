package com.goerdes.textguard.services;

import com.goerdes.textguard.components.search.SearchProvider;
import com.goerdes.textguard.utils.ShingleUtils;
import com.goerdes.textguard.utils.TimeBudget;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Finds candidate source URLs for a submission by searching for a few of its phrases.
 * <p>
 * Searches run on a small bounded pool under one deadline per request. Providers that time
 * out or fail contribute nothing; the configured fallback seeds are then appended so a check
 * still has somewhere to look.
 */
@Service
public class CandidateDiscovery {

    private static final Logger log = LoggerFactory.getLogger(CandidateDiscovery.class);

    private final SearchProvider searchProvider;
    private final int phraseWords;
    private final Duration searchTimeout;
    private final List<String> fallbackSeeds;
    private final ExecutorService executor;

    public CandidateDiscovery(SearchProvider searchProvider,
                              @Value("${textguard.discovery.phrase-words:8}") int phraseWords,
                              @Value("${textguard.search.timeout:8s}") Duration searchTimeout,
                              @Value("${textguard.discovery.fallback-seeds:}") List<String> fallbackSeeds,
                              @Value("${textguard.search.threads:4}") int threads) {
        this.searchProvider = searchProvider;
        this.phraseWords = phraseWords;
        this.searchTimeout = searchTimeout;
        this.fallbackSeeds = fallbackSeeds.stream().map(String::trim).filter(s -> !s.isEmpty()).toList();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "search-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Collects up to {@code maxUrls} distinct URLs for the submission's phrases.
     *
     * @param tokens     the submission's token sequence
     * @param maxPhrases how many phrases to search for
     * @param maxUrls    cap on the returned URLs
     * @param budget     the request budget; the search deadline never exceeds it
     * @return distinct URLs, search results first, then fallback seeds
     */
    public List<String> discover(List<String> tokens, int maxPhrases, int maxUrls, TimeBudget budget) {
        Set<String> urls = new LinkedHashSet<>();
        if (maxUrls <= 0) {
            return List.of();
        }
        boolean degraded = false;

        if (searchProvider.isEnabled()) {
            List<String> phrases = ShingleUtils.phrases(tokens, phraseWords, maxPhrases);
            List<Future<List<String>>> futures = new ArrayList<>(phrases.size());
            for (String phrase : phrases) {
                futures.add(executor.submit(() -> searchProvider.search("\"" + phrase + "\"", maxUrls)));
            }

            long deadline = System.nanoTime()
                    + TimeUnit.MILLISECONDS.toNanos(Math.min(searchTimeout.toMillis(), budget.remainingMs()));
            for (Future<List<String>> future : futures) {
                try {
                    long left = Math.max(0, deadline - System.nanoTime());
                    for (String url : future.get(left, TimeUnit.NANOSECONDS)) {
                        if (urls.size() >= maxUrls) {
                            break;
                        }
                        urls.add(url);
                    }
                } catch (TimeoutException e) {
                    future.cancel(true);
                    degraded = true;
                    log.warn("Search timed out");
                } catch (ExecutionException e) {
                    degraded = true;
                    log.warn("Search failed: {}", e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    future.cancel(true);
                    degraded = true;
                }
            }
            log.debug("Search returned {} urls for {} phrases", urls.size(), phrases.size());
        }

        if (degraded || urls.isEmpty()) {
            for (String seed : fallbackSeeds) {
                if (urls.size() >= maxUrls) {
                    break;
                }
                urls.add(seed);
            }
        }
        return new ArrayList<>(urls);
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}

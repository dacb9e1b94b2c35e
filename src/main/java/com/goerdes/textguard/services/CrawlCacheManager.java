package com.goerdes.textguard.services;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goerdes.textguard.components.PageCache;
import com.goerdes.textguard.components.PageFetcher;
import com.goerdes.textguard.components.RobotsPolicy;
import com.goerdes.textguard.components.Shingler;
import com.goerdes.textguard.db.PageEntity;
import com.goerdes.textguard.handler.HtmlTextHandler;
import com.goerdes.textguard.model.ExtractionResult;
import com.goerdes.textguard.model.FetchOutcome;
import com.goerdes.textguard.model.FetchedPage;
import com.goerdes.textguard.model.PageOrigin;
import com.goerdes.textguard.utils.TimeBudget;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static com.goerdes.textguard.model.FetchOutcome.Status.BLOCKED;
import static com.goerdes.textguard.model.FetchOutcome.Status.CACHED;
import static com.goerdes.textguard.model.FetchOutcome.Status.FAILED;
import static com.goerdes.textguard.model.FetchOutcome.Status.FETCHED;
import static com.goerdes.textguard.model.FetchOutcome.Status.SKIPPED;
import static com.goerdes.textguard.model.FetchOutcome.Status.TOO_SHORT;

/**
 * Turns candidate URLs into page text, going to the network only when the cached copy is
 * missing or stale.
 * <p>
 * A visit runs: fresh cache hit, robots check, per-host throttle, fetch, extraction, word floor,
 * then write-through to the page cache and the corpus. Concurrent visits of the same URL share
 * one in-flight fetch.
 */
@Service
public class CrawlCacheManager {

    private static final Logger log = LoggerFactory.getLogger(CrawlCacheManager.class);

    private final PageCache pageCache;
    private final RobotsPolicy robotsPolicy;
    private final PageFetcher pageFetcher;
    private final HtmlTextHandler htmlTextHandler;
    private final TextHandlerRegistry handlerRegistry;
    private final CorpusStore corpusStore;
    private final Shingler shingler;
    private final long delayMillis;
    private final int minWords;

    private final Map<String, CompletableFuture<FetchOutcome>> inFlight = new ConcurrentHashMap<>();
    private final Cache<String, Long> nextSlotByHost = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterWrite(Duration.ofMinutes(10))
            .build();

    public CrawlCacheManager(PageCache pageCache,
                             RobotsPolicy robotsPolicy,
                             PageFetcher pageFetcher,
                             HtmlTextHandler htmlTextHandler,
                             TextHandlerRegistry handlerRegistry,
                             CorpusStore corpusStore,
                             Shingler shingler,
                             @Value("${textguard.crawl.delay:1000ms}") Duration delay,
                             @Value("${textguard.crawl.min-words:50}") int minWords) {
        this.pageCache = pageCache;
        this.robotsPolicy = robotsPolicy;
        this.pageFetcher = pageFetcher;
        this.htmlTextHandler = htmlTextHandler;
        this.handlerRegistry = handlerRegistry;
        this.corpusStore = corpusStore;
        this.shingler = shingler;
        this.delayMillis = delay.toMillis();
        this.minWords = minWords;
    }

    /**
     * Visits the URLs in order until the budget runs out; the remaining ones are {@code SKIPPED}.
     */
    public List<FetchOutcome> visitAll(List<String> urls, TimeBudget budget) {
        List<FetchOutcome> outcomes = new ArrayList<>(urls.size());
        for (String url : urls) {
            if (budget.exhausted()) {
                outcomes.add(FetchOutcome.of(url, SKIPPED, "request budget exhausted"));
                continue;
            }
            outcomes.add(visit(url));
        }
        return outcomes;
    }

    /**
     * Returns the text of the URL from cache or network. Never throws.
     */
    public FetchOutcome visit(String url) {
        CompletableFuture<FetchOutcome> mine = new CompletableFuture<>();
        CompletableFuture<FetchOutcome> running = inFlight.putIfAbsent(url, mine);
        if (running != null) {
            log.debug("Joining in-flight fetch of {}", url);
            return running.join();
        }
        FetchOutcome outcome = null;
        try {
            outcome = doVisit(url);
        } catch (RuntimeException e) {
            log.warn("Visit of {} failed: {}", url, e.getMessage());
            outcome = FetchOutcome.of(url, FAILED, e.getMessage());
        } finally {
            inFlight.remove(url, mine);
            // waiters must be released even when doVisit threw an Error
            if (outcome != null) {
                mine.complete(outcome);
            } else {
                mine.completeExceptionally(new IllegalStateException("Visit of " + url + " aborted"));
            }
        }
        return outcome;
    }

    private FetchOutcome doVisit(String url) {
        String host = hostOf(url);
        if (host == null) {
            return FetchOutcome.of(url, FAILED, "not an absolute http(s) URL");
        }

        Optional<String> cached = pageCache.getFresh(url);
        if (cached.isPresent()) {
            log.debug("Cache hit for {}", url);
            Long pageId = corpusStore.findIdByUrl(url)
                    .orElseGet(() -> store(url, host, cached.get()));
            return new FetchOutcome(url, CACHED, cached.get(), pageId, null);
        }

        if (!robotsPolicy.isAllowed(url)) {
            log.info("robots.txt disallows {}", url);
            return FetchOutcome.of(url, BLOCKED, "disallowed by robots.txt");
        }

        try {
            throttle(host, Math.max(delayMillis, robotsPolicy.crawlDelayMillis(url)));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchOutcome.of(url, SKIPPED, "interrupted while throttled");
        }

        FetchedPage page;
        try {
            page = pageFetcher.fetch(url);
        } catch (IOException e) {
            log.warn("Fetch of {} failed: {}", url, e.getMessage());
            return FetchOutcome.of(url, FAILED, e.getMessage());
        }
        if (!page.isSuccess()) {
            log.warn("Fetch of {} returned HTTP {}", url, page.statusCode());
            return FetchOutcome.of(url, FAILED, "HTTP " + page.statusCode());
        }

        ExtractionResult extracted = extract(url, page);
        if (!extracted.isOk()) {
            log.debug("No text extracted from {}: {}", url, extracted.detail());
            return FetchOutcome.of(url, FAILED, extracted.detail());
        }
        String text = extracted.text();
        int words = shingler.tokens(text).size();
        if (words < minWords) {
            log.debug("{} has only {} words, below floor of {}", url, words, minWords);
            return FetchOutcome.of(url, TOO_SHORT, words + " words");
        }

        try {
            pageCache.put(url, text);
        } catch (RuntimeException e) {
            log.error("Failed to cache {}: {}", url, e.getMessage());
        }
        Long pageId = store(url, host, text);
        log.info("Fetched {} ({} words)", url, words);
        return new FetchOutcome(url, FETCHED, text, pageId, null);
    }

    private Long store(String url, String host, String text) {
        try {
            PageEntity saved = corpusStore.upsertPage(url, url, host, PageOrigin.WEB, text);
            return saved.getId();
        } catch (RuntimeException e) {
            log.error("Failed to store page {}: {}", url, e.getMessage());
            return null;
        }
    }

    private ExtractionResult extract(String url, FetchedPage page) {
        String contentType = page.contentType() == null ? "" : page.contentType().toLowerCase(Locale.ROOT);
        if (page.isHtml() || contentType.isEmpty()) {
            try {
                return htmlTextHandler.extract(Jsoup.parse(new ByteArrayInputStream(page.body()), null, url));
            } catch (IOException e) {
                return ExtractionResult.failed(ExtractionResult.Failure.EXTRACTION_ERROR, e.getMessage());
            }
        }
        if (contentType.contains("pdf")) {
            return handlerRegistry.extract("page.pdf", page.body());
        }
        if (contentType.startsWith("text/plain")) {
            return handlerRegistry.extract("page.txt", page.body());
        }
        if (contentType.contains("csv")) {
            return handlerRegistry.extract("page.csv", page.body());
        }
        return handlerRegistry.extract(fileNameOf(url), page.body());
    }

    /**
     * Reserves the next fetch slot of the host and sleeps until it starts. The map update is
     * atomic per host; the sleep happens outside it.
     */
    private void throttle(String host, long spacingMillis) throws InterruptedException {
        if (spacingMillis <= 0) {
            return;
        }
        long now = System.currentTimeMillis();
        long slot = nextSlotByHost.asMap().compute(host, (h, next) -> Math.max(now, next == null ? now : next) + spacingMillis)
                - spacingMillis;
        long wait = slot - now;
        if (wait > 0) {
            log.debug("Throttling {} for {} ms", host, wait);
            Thread.sleep(wait);
        }
    }

    static String hostOf(String url) {
        try {
            URI uri = new URI(url);
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
                return null;
            }
            return uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static String fileNameOf(String url) {
        try {
            String path = new URI(url).getPath();
            if (path == null || path.isEmpty() || path.endsWith("/")) {
                return "page.html";
            }
            return path.substring(path.lastIndexOf('/') + 1);
        } catch (URISyntaxException e) {
            return "page.html";
        }
    }
}

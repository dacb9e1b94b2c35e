package com.goerdes.textguard.components;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.goerdes.textguard.model.FetchedPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Decides whether a URL may be crawled according to its host's robots.txt.
 * <p>
 * Rules are fetched per scheme/host/port and memoized until {@code textguard.robots.ttl} has
 * passed on the injected clock. A missing robots.txt (any non-2xx status) or an unreachable
 * host allows everything. The longest matching Allow/Disallow prefix
 * wins; on a tie Allow wins.
 */
@Component
public class RobotsPolicy {

    private static final Logger log = LoggerFactory.getLogger(RobotsPolicy.class);

    private final PageFetcher pageFetcher;

    private final Cache<String, Rules> rulesByHost;

    public RobotsPolicy(PageFetcher pageFetcher,
                        Clock clock,
                        @Value("${textguard.robots.ttl:24h}") Duration ttl,
                        @Value("${textguard.robots.max-hosts:10000}") long maxHosts) {
        this.pageFetcher = pageFetcher;
        this.rulesByHost = Caffeine.newBuilder()
                .maximumSize(maxHosts)
                .expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * @param url the absolute URL to check
     * @return {@code true} if crawling the URL is permitted
     */
    public boolean isAllowed(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return false;
        }
        if (uri.getHost() == null) {
            return false;
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        return rulesFor(uri).allows(path);
    }

    /**
     * Crawl-delay requested by the host for our agent, in milliseconds, or 0.
     */
    public long crawlDelayMillis(String url) {
        try {
            URI uri = new URI(url);
            return uri.getHost() == null ? 0 : rulesFor(uri).crawlDelayMillis();
        } catch (URISyntaxException e) {
            return 0;
        }
    }

    public void clear() {
        rulesByHost.invalidateAll();
    }

    private Rules rulesFor(URI uri) {
        String origin = uri.getScheme() + "://" + uri.getHost() + (uri.getPort() > 0 ? ":" + uri.getPort() : "");
        Rules rules = rulesByHost.getIfPresent(origin);
        if (rules != null) {
            return rules;
        }
        // fetched outside the cache so no entry lock is held during network I/O
        Rules loaded = loadRules(origin);
        Rules raced = rulesByHost.asMap().putIfAbsent(origin, loaded);
        return raced != null ? raced : loaded;
    }

    private Rules loadRules(String origin) {
        String robotsUrl = origin + "/robots.txt";
        try {
            FetchedPage page = pageFetcher.fetch(robotsUrl);
            if (!page.isSuccess()) {
                log.debug("No robots.txt at {} (HTTP {})", robotsUrl, page.statusCode());
                return Rules.ALLOW_ALL;
            }
            return parse(new String(page.body(), StandardCharsets.UTF_8), pageFetcher.userAgent());
        } catch (IOException e) {
            log.debug("robots.txt unreachable at {}: {}", robotsUrl, e.getMessage());
            return Rules.ALLOW_ALL;
        }
    }

    /**
     * Parses robots.txt, keeping the group for our agent token or, failing that, the {@code *} group.
     */
    static Rules parse(String robotsText, String userAgent) {
        String agent = agentToken(userAgent);
        Map<String, List<Rule>> byAgent = new LinkedHashMap<>();
        Map<String, Long> delayByAgent = new LinkedHashMap<>();
        List<String> currentAgents = new ArrayList<>();
        boolean lastWasAgent = false;

        for (String raw : robotsText.replace("\r", "").split("\n")) {
            String line = raw.split("#", 2)[0].trim();
            int colon = line.indexOf(':');
            if (line.isEmpty() || colon < 0) {
                continue;
            }
            String key = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String val = line.substring(colon + 1).trim();

            switch (key) {
                case "user-agent" -> {
                    if (!lastWasAgent) {
                        currentAgents = new ArrayList<>();
                    }
                    String ua = val.toLowerCase(Locale.ROOT);
                    currentAgents.add(ua);
                    byAgent.putIfAbsent(ua, new ArrayList<>());
                    lastWasAgent = true;
                }
                case "allow", "disallow" -> {
                    lastWasAgent = false;
                    Rule rule = new Rule(key.equals("allow"), val);
                    for (String ua : currentAgents) {
                        byAgent.get(ua).add(rule);
                    }
                }
                case "crawl-delay" -> {
                    lastWasAgent = false;
                    try {
                        long ms = Math.round(Double.parseDouble(val) * 1000.0);
                        for (String ua : currentAgents) {
                            delayByAgent.put(ua, Math.max(0, ms));
                        }
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring malformed Crawl-delay '{}'", val);
                    }
                }
                default -> lastWasAgent = false;
            }
        }

        String group = byAgent.containsKey(agent) ? agent : "*";
        return new Rules(byAgent.getOrDefault(group, List.of()), delayByAgent.getOrDefault(group, 0L));
    }

    private static String agentToken(String userAgent) {
        String token = userAgent.split("/", 2)[0].trim();
        return token.toLowerCase(Locale.ROOT);
    }

    record Rule(boolean allow, String prefix) {}

    record Rules(List<Rule> rules, long crawlDelayMillis) {

        static final Rules ALLOW_ALL = new Rules(List.of(), 0L);

        boolean allows(String path) {
            Rule best = null;
            for (Rule rule : rules) {
                // an empty Disallow means "allow everything"
                if (rule.prefix().isEmpty() || !path.startsWith(rule.prefix())) {
                    continue;
                }
                if (best == null
                        || rule.prefix().length() > best.prefix().length()
                        || (rule.prefix().length() == best.prefix().length() && rule.allow())) {
                    best = rule;
                }
            }
            return best == null || best.allow();
        }
    }
}

package com.goerdes.textguard.components;

import com.goerdes.textguard.model.FetchedPage;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;

/**
 * {@link PageFetcher} backed by a Jsoup connection with a hard timeout and body size cap.
 */
@Component
public class JsoupPageFetcher implements PageFetcher {

    private final Duration timeout;
    private final int maxBodyBytes;
    private final String userAgent;

    public JsoupPageFetcher(@Value("${textguard.crawl.timeout:10s}") Duration timeout,
                            @Value("${textguard.crawl.max-body-bytes:5242880}") int maxBodyBytes,
                            @Value("${textguard.crawl.user-agent:TextGuardBot/1.0}") String userAgent) {
        this.timeout = timeout;
        this.maxBodyBytes = maxBodyBytes;
        this.userAgent = userAgent;
    }

    @Override
    public FetchedPage fetch(String url) throws IOException {
        Connection.Response response = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout((int) timeout.toMillis())
                .maxBodySize(maxBodyBytes)
                .ignoreContentType(true)
                .ignoreHttpErrors(true)
                .followRedirects(true)
                .execute();
        return new FetchedPage(
                response.url().toString(),
                response.statusCode(),
                response.contentType(),
                response.bodyAsBytes()
        );
    }

    @Override
    public String userAgent() {
        return userAgent;
    }
}

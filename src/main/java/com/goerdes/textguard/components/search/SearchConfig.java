package com.goerdes.textguard.components.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class SearchConfig {

    private static final Logger log = LoggerFactory.getLogger(SearchConfig.class);

    /**
     * The JSON provider when {@code textguard.search.base-url} is set, otherwise a no-op provider.
     */
    @Bean
    public SearchProvider searchProvider(@Value("${textguard.search.base-url:}") String baseUrl,
                                         @Value("${textguard.search.http-timeout:5s}") Duration timeout,
                                         RestTemplateBuilder builder,
                                         ObjectMapper mapper) {
        if (baseUrl == null || baseUrl.isBlank()) {
            log.info("No search endpoint configured, web discovery uses fallback seeds only");
            return new NoopSearchProvider();
        }
        log.info("Web discovery uses search endpoint {}", baseUrl);
        return new JsonSearchProvider(
                builder.setConnectTimeout(timeout).setReadTimeout(timeout).build(),
                mapper,
                baseUrl
        );
    }

}

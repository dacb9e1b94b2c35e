package com.goerdes.textguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
public class TextGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TextGuardApplication.class, args);
    }

    /**
     * Time source for cache freshness and page timestamps; tests replace it to move time.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

}

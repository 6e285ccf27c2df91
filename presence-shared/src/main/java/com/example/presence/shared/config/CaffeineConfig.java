package com.example.presence.shared.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class CaffeineConfig {

    /**
     * Resolved display names keyed by raw user id.
     */
    @Bean
    public Cache<String, String> displayNameCache(AppProperties appProperties) {
        AppProperties.Cache cache = appProperties.getCache();
        return Caffeine.newBuilder()
                .maximumSize(cache.getDisplayNamesMaximumSize())
                .expireAfterWrite(Duration.ofMinutes(cache.getDisplayNamesExpireAfterWriteMinutes()))
                .recordStats()
                .build();
    }
}

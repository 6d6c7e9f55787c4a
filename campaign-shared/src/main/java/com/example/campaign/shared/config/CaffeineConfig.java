package com.example.campaign.shared.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

@Configuration
public class CaffeineConfig {

    /**
     * Value sets of data-derived segment dimensions, keyed by dimension id.
     * Subscriber churn happens in other processes, so entries expire instead of being kept forever.
     */
    @Bean
    public Cache<String, Set<String>> segmentValuesCache(AppProperties appProperties) {
        AppProperties.Segments segments = appProperties.getSegments();
        return Caffeine.newBuilder()
                .maximumSize(segments.getValuesCacheMaxSize())
                .expireAfterWrite(segments.getValuesCacheTtl())
                .recordStats()
                .build();
    }
}

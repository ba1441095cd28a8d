package com.gt.dailyprep.conf;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CachingConfig {

    public static final String TOPICS = "topics";

    @Bean
    public CacheManager getTopicCacheManager() {
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(TOPICS);
        return cacheManager;
    }
}

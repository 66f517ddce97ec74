package com.aiinpocket.stakepool.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 快取配置。
 * 使用 Caffeine 本地快取鎖倉級距設定（讀多寫少，管理員修改時整批清除）。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String LOCKUP_TIERS = "lockupTiers";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(LOCKUP_TIERS);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(32));
        return manager;
    }
}

package com.convoagent.config;

import com.convoagent.domain.admission.model.valobj.RateBudget;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Guava 本地缓存配置。
 */
@Configuration
public class GuavaConfig {

    /**
     * 准入计数缓存。窗口过期后的计数在下一次访问时重置，这里只负责回收长期不活跃的身份。
     */
    @Bean(name = "rateBudgetCache")
    public Cache<String, RateBudget> rateBudgetCache(AgentRateLimitProperties properties) {
        long expireSeconds = Math.max(properties.getWindow().getSeconds() * 2L, 60L);
        return CacheBuilder.newBuilder()
                .maximumSize(Math.max(properties.getMaxTrackedIdentities(), 1L))
                .expireAfterAccess(expireSeconds, TimeUnit.SECONDS)
                .build();
    }

}

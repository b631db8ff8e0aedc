package com.hao.posts.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hao.posts.dal.model.Post;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 本地缓存配置类
 *
 * 类职责：
 * 配置 Redis 存储使用的 Caffeine 帖子详情缓存。
 *
 * 为什么需要该类：
 * 避免在存储实现中硬编码缓存容量与过期策略，便于按环境调优。
 */
@Configuration
@ConditionalOnProperty(name = "posts.store.type", havingValue = "redis", matchIfMissing = true)
public class CacheConfig {

    /**
     * 帖子详情缓存实例
     *
     * 实现逻辑：
     * 1. maximumSize 限制条目数，防止随机 id 扫描撑爆内存。
     * 2. expireAfterWrite 兜底回收，外部清库后最终与 Redis 保持一致。
     *
     * @param maximumSize 最大条目数
     * @param expireMinutes 写入后过期分钟数
     * @return 帖子缓存 Bean
     */
    @Bean("postCache")
    public Cache<Long, Post> postCache(@Value("${posts.cache.maximum-size:10000}") long maximumSize,
                                       @Value("${posts.cache.expire-after-write-minutes:30}") long expireMinutes) {
        return Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(expireMinutes, TimeUnit.MINUTES)
                .build();
    }
}

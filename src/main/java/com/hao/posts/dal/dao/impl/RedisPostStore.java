package com.hao.posts.dal.dao.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.hao.posts.common.enums.RedisKeysEnum;
import com.hao.posts.common.util.JsonUtil;
import com.hao.posts.dal.dao.PostStore;
import com.hao.posts.dal.model.Post;
import com.hao.posts.integration.redis.RedisClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 基于 Redis 的帖子存储
 *
 * 类职责：
 * 使用 Redis 字符串、哈希、有序集合实现帖子的发号、存储与有序读取。
 *
 * 设计目的：
 * 1. 依赖 INCR 的原子性保证并发创建时 id 唯一且递增，业务层无需加锁。
 * 2. 通过有序集合索引保证列表按 id 升序返回。
 *
 * 核心实现思路：
 * - 发号器：INCR {prefix}id:seq，空库第一个 id 为 1。
 * - 详情与索引：同一 Lua 脚本内执行 ZADD {prefix}index {id} {id} 与 HSET {prefix}info {id} {json}，分值即 id。
 * - 详情损坏时抛出 IllegalStateException，不按不存在处理。
 * - 帖子创建后不可变，详情查询结果放入本地 Caffeine 缓存，清表时整体失效。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "posts.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisPostStore implements PostStore {

    private final RedisClient<String> redisClient;

    private final Cache<Long, Post> postCache;

    private final String seqKey;

    private final String infoKey;

    private final String indexKey;

    public RedisPostStore(RedisClient<String> redisClient,
                          @Qualifier("postCache") Cache<Long, Post> postCache,
                          @Value("${posts.store.redis.key-prefix:posts:}") String keyPrefix) {
        this.redisClient = redisClient;
        this.postCache = postCache;
        this.seqKey = RedisKeysEnum.POST_ID_SEQ.withPrefix(keyPrefix);
        this.infoKey = RedisKeysEnum.POST_INFO.withPrefix(keyPrefix);
        this.indexKey = RedisKeysEnum.POST_INDEX.withPrefix(keyPrefix);
    }

    /**
     * 读取全部帖子
     *
     * 实现逻辑：
     * 1. ZRANGE 读取升序 id 列表。
     * 2. HMGET 批量获取详情，避免 N+1 查询。
     * 3. 跳过索引中存在但详情缺失的 id，保持 id 顺序。详情损坏时直接失败。
     */
    @Override
    public List<Post> list() {
        Set<String> ids = redisClient.zrange(indexKey, 0, -1);
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> jsonList = redisClient.hmget(infoKey, new ArrayList<>(ids));
        return jsonList.stream()
                .filter(Objects::nonNull)
                .map(item -> JsonUtil.toBean(item, Post.class))
                .toList();
    }

    /**
     * 按 id 查询帖子
     *
     * 实现逻辑：
     * 1. 先查本地缓存。
     * 2. 未命中时 HGET 读取详情并回填缓存。不存在的 id 不做空值缓存，避免并发创建后读不到。
     */
    @Override
    public Optional<Post> find(long id) {
        Post cached = postCache.getIfPresent(id);
        if (cached != null) {
            return Optional.of(copyOf(cached));
        }
        String json = redisClient.hget(infoKey, String.valueOf(id));
        if (json == null) {
            return Optional.empty();
        }
        Post post = JsonUtil.toBean(json, Post.class);
        postCache.put(id, post);
        return Optional.of(copyOf(post));
    }

    /**
     * 创建帖子
     *
     * 实现逻辑：
     * 1. INCR 生成新 id。
     * 2. 通过脚本原子写入详情与顺序索引，列表与详情查询看到同一批数据。
     * 3. 回填本地缓存。
     */
    @Override
    public Post create(String title, String body) {
        long id = redisClient.incr(seqKey);
        Post post = new Post(id, title, body);
        String field = String.valueOf(id);
        redisClient.hsetWithIndex(infoKey, indexKey, field, JsonUtil.toJson(post), id);
        postCache.put(id, post);
        log.info("帖子写入Redis|Redis_post_created,id={}", id);
        return copyOf(post);
    }

    @Override
    public void createSchema() {
        // Redis 无需建表
        log.info("Redis存储初始化|Redis_store_schema_ready,seqKey={},infoKey={},indexKey={}", seqKey, infoKey, indexKey);
    }

    @Override
    public void dropSchema() {
        Long deleted = redisClient.del(seqKey, infoKey, indexKey);
        postCache.invalidateAll();
        log.info("Redis存储清理完成|Redis_store_schema_dropped,deletedKeys={}", deleted);
    }

    private static Post copyOf(Post post) {
        return new Post(post.getId(), post.getTitle(), post.getBody());
    }
}

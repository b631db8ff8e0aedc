package com.hao.posts.integration.redis;

import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * RedisClient 接口实现
 *
 * 类职责：
 * 基于 StringRedisTemplate 封装帖子存储所需命令，并提供参数校验。
 *
 * 核心实现思路：
 * - 各方法按数据结构映射 Redis 原生命令。
 * - 统一进行参数校验与空值处理，模板返回 null 时转换为空集合或 0。
 */
public class RedisClientImpl implements RedisClient<String> {

    /**
     * 先登记索引再写详情：脚本中途失败时只会留下无详情的索引成员，读取时按缺失处理。
     * KEYS=[详情键, 索引键], ARGV=[字段, 值, 分值]
     */
    private static final String HSET_WITH_INDEX_SCRIPT =
            "local added = redis.call('ZADD', KEYS[2], ARGV[3], ARGV[1]) " +
            "redis.call('HSET', KEYS[1], ARGV[1], ARGV[2]) " +
            "return added";

    private final StringRedisTemplate redisTemplate;

    private final DefaultRedisScript<Long> hsetWithIndexScript;

    public RedisClientImpl(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.hsetWithIndexScript = new DefaultRedisScript<>();
        this.hsetWithIndexScript.setScriptText(HSET_WITH_INDEX_SCRIPT);
        this.hsetWithIndexScript.setResultType(Long.class);
    }

    /* ------------------ 辅助校验 ------------------ */

    /**
     * 校验字符串参数
     *
     * @param key 待校验参数
     * @param name 参数名称
     */
    private void validateKey(String key, String name) {
        if (!StringUtils.hasText(key)) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
    }

    private void validateParams(Object[] params, String name) {
        if (params == null || params.length == 0) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
    }

    private void validateCollection(Collection<?> collection, String name) {
        if (collection == null || collection.isEmpty()) {
            throw new IllegalArgumentException(name + " 不能为空");
        }
    }

    // 区域：字符串

    /** 字符串 -> INCR：整数加 1，键不存在时从 0 开始。 */
    @Override
    public Long incr(String key) {
        validateKey(key, "key");
        return redisTemplate.opsForValue().increment(key);
    }

    /** 通用 -> DEL：删除多个 key。 */
    @Override
    public Long del(String... keys) {
        validateParams(keys, "keys");
        Long deleted = redisTemplate.delete(Arrays.asList(keys));
        return deleted != null ? deleted : 0L;
    }

    // 区域：哈希

    /** 哈希 -> HGET：读取字段。 */
    @Override
    public String hget(String key, String field) {
        validateKey(key, "key");
        validateKey(field, "field");
        Object val = redisTemplate.opsForHash().get(key, field);
        return val != null ? val.toString() : null;
    }

    /** 哈希 -> HMGET：批量读字段。 */
    @Override
    public List<String> hmget(String key, List<String> fields) {
        validateKey(key, "key");
        validateCollection(fields, "fields");
        List<Object> vals = redisTemplate.opsForHash().multiGet(key, new ArrayList<>(fields));
        return vals.stream().map(v -> v != null ? v.toString() : null).collect(Collectors.toList());
    }

    // 区域：有序集合

    /** 有序集合 -> ZRANGE：按索引升序取，结果保持分值顺序。 */
    @Override
    public Set<String> zrange(String key, long start, long stop) {
        validateKey(key, "key");
        Set<String> result = redisTemplate.opsForZSet().range(key, start, stop);
        return result != null ? result : Collections.emptySet();
    }

    // 区域：脚本

    /** 脚本 -> EVAL：ZADD 与 HSET 在同一 Lua 脚本内原子执行。 */
    @Override
    public Long hsetWithIndex(String hashKey, String indexKey, String field, String value, double score) {
        validateKey(hashKey, "hashKey");
        validateKey(indexKey, "indexKey");
        validateKey(field, "field");
        validateKey(value, "value");
        Long added = redisTemplate.execute(hsetWithIndexScript, List.of(hashKey, indexKey),
                field, value, String.valueOf(score));
        return added != null ? added : 0L;
    }
}

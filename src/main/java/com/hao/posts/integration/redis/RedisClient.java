package com.hao.posts.integration.redis;

import java.util.List;
import java.util.Set;

/**
 * 统一 Redis 客户端接口
 *
 * 类职责：
 * 定义帖子存储用到的字符串、哈希、有序集合命令的统一访问入口。
 *
 * 设计目的：
 * 1. 屏蔽底层模板差异，存储层只面向命令语义编程。
 * 2. 便于在单元测试中替换为 Mock。
 *
 * 核心实现思路：
 * - 按 Redis 数据类型分组定义方法。
 * - 实现层负责参数校验与模板调用。
 *
 * @param <T> 值类型（如 String 或序列化后的对象）
 */
public interface RedisClient<T> {

    // 区域：字符串

    /**
     * 字符串 -> INCR，整数加 1。示例：INCR posts:id:seq。
     *
     * @return 自增后的值
     */
    Long incr(String key);

    /**
     * 通用 -> DEL，删除多个 key。示例：DEL a b c。
     *
     * @return 实际删除数量
     */
    Long del(String... keys);

    // 区域：哈希

    /**
     * 哈希 -> HGET，读取字段。示例：HGET posts:info 1。
     */
    T hget(String key, String field);

    /**
     * 哈希 -> HMGET，批量读字段，结果与 fields 顺序一致，缺失字段为 null。
     */
    List<T> hmget(String key, List<String> fields);

    // 区域：有序集合

    /**
     * 有序集合 -> ZRANGE，按分值升序取区间。示例：ZRANGE posts:index 0 -1。
     */
    Set<T> zrange(String key, long start, long stop);

    // 区域：脚本

    /**
     * 脚本 -> EVAL，原子写入哈希字段并登记有序集合索引。
     * 等价于 ZADD indexKey score field + HSET hashKey field value，两条命令在同一脚本内执行。
     *
     * @param hashKey 详情哈希键
     * @param indexKey 索引有序集合键
     * @param field 哈希字段，同时作为索引成员
     * @param value 字段值
     * @param score 索引分值
     * @return 索引新增成员数
     */
    Long hsetWithIndex(String hashKey, String indexKey, String field, T value, double score);
}

package com.hao.posts.common.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Redis键枚举定义
 *
 * 类职责：
 * 统一管理帖子存储使用的 Redis 键后缀与说明，避免硬编码散落在各处。
 *
 * 核心实现思路：
 * - 枚举只承载键后缀，实际键由配置的前缀拼接生成，便于多环境隔离。
 */
@Getter
@AllArgsConstructor
public enum RedisKeysEnum {

    /**
     * 帖子 ID 全局发号器
     * 类型：字符串
     * 用法：INCR posts:id:seq -> 返回 1, 2, 3...
     */
    POST_ID_SEQ("id:seq", "帖子ID生成器"),

    /**
     * 帖子详情
     * 类型：哈希
     * 用法：HSET posts:info {id} {json}
     */
    POST_INFO("info", "帖子详情字典"),

    /**
     * 帖子顺序索引
     * 类型：有序集合
     * 用法：ZADD posts:index {id} {id}，分值即 id，保证按 id 升序读取
     */
    POST_INDEX("index", "帖子ID升序索引");

    private final String key;
    private final String desc;

    /**
     * 拼接业务键
     *
     * @param prefix 键前缀（如 "posts:"）
     * @return 拼接后的完整键
     */
    public String withPrefix(String prefix) {
        return prefix + this.key;
    }
}

package com.hao.posts.dal.dao.impl;

import com.hao.posts.dal.dao.PostStore;
import com.hao.posts.dal.model.Post;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 内存帖子存储
 *
 * 类职责：
 * 在进程内保存帖子，供本地运行与测试替换 Redis 存储。
 *
 * 核心实现思路：
 * - AtomicLong 发号，保证并发创建时 id 唯一递增。
 * - ConcurrentSkipListMap 按 id 排序，遍历即升序。
 * - 对外只返回副本，调用方修改不会影响存储内容。
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "posts.store.type", havingValue = "memory")
public class InMemoryPostStore implements PostStore {

    private final ConcurrentNavigableMap<Long, Post> posts = new ConcurrentSkipListMap<>();

    private final AtomicLong sequence = new AtomicLong();

    @Override
    public List<Post> list() {
        return posts.values().stream()
                .map(InMemoryPostStore::copyOf)
                .toList();
    }

    @Override
    public Optional<Post> find(long id) {
        return Optional.ofNullable(posts.get(id)).map(InMemoryPostStore::copyOf);
    }

    @Override
    public Post create(String title, String body) {
        long id = sequence.incrementAndGet();
        Post post = new Post(id, title, body);
        posts.put(id, post);
        return copyOf(post);
    }

    @Override
    public void createSchema() {
        log.debug("内存存储初始化|Memory_store_schema_ready");
    }

    /**
     * 清空全部帖子并重置发号器，下一个 id 重新从 1 开始。
     */
    @Override
    public void dropSchema() {
        posts.clear();
        sequence.set(0);
        log.debug("内存存储清理完成|Memory_store_schema_dropped");
    }

    private static Post copyOf(Post post) {
        return new Post(post.getId(), post.getTitle(), post.getBody());
    }
}

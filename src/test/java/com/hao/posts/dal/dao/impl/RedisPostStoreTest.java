package com.hao.posts.dal.dao.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hao.posts.dal.model.Post;
import com.hao.posts.integration.redis.RedisClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * Redis 帖子存储测试
 *
 * 测试目的：
 * 1. 验证发号后详情与索引通过一次原子写入完成。
 * 2. 验证列表按索引顺序组装，详情损坏时失败而不是当作不存在。
 * 3. 验证详情缓存与清表时的缓存失效。
 *
 * 设计思路：
 * - Mock RedisClient，不依赖真实 Redis。
 */
@ExtendWith(MockitoExtension.class)
class RedisPostStoreTest {

    private static final String SEQ = "test:posts:id:seq";
    private static final String INFO = "test:posts:info";
    private static final String INDEX = "test:posts:index";

    @Mock
    private RedisClient<String> redisClient;

    private Cache<Long, Post> cache;

    private RedisPostStore store;

    @BeforeEach
    void setUp() {
        cache = Caffeine.newBuilder().maximumSize(100).build();
        store = new RedisPostStore(redisClient, cache, "test:posts:");
    }

    @Test
    @DisplayName("创建帖子：INCR 发号后原子写入详情与索引")
    void testCreate() {
        when(redisClient.incr(SEQ)).thenReturn(1L);

        Post created = store.create("Example Post", "Just a test");

        assertThat(created).isEqualTo(new Post(1L, "Example Post", "Just a test"));
        InOrder order = inOrder(redisClient);
        order.verify(redisClient).incr(SEQ);
        order.verify(redisClient).hsetWithIndex(INFO, INDEX, "1",
                "{\"id\":1,\"title\":\"Example Post\",\"body\":\"Just a test\"}", 1.0);
        verifyNoMoreInteractions(redisClient);
        assertThat(cache.getIfPresent(1L)).isEqualTo(created);
    }

    @Test
    @DisplayName("创建帖子：详情与索引写入失败时异常上抛，不回填缓存，也没有单独写入的详情")
    void testCreateWriteFailure() {
        when(redisClient.incr(SEQ)).thenReturn(1L);
        when(redisClient.hsetWithIndex(INFO, INDEX, "1",
                "{\"id\":1,\"title\":\"t\",\"body\":\"b\"}", 1.0))
                .thenThrow(new IllegalStateException("index down"));

        assertThatThrownBy(() -> store.create("t", "b"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("index down");

        verify(redisClient).incr(SEQ);
        verify(redisClient).hsetWithIndex(INFO, INDEX, "1",
                "{\"id\":1,\"title\":\"t\",\"body\":\"b\"}", 1.0);
        verifyNoMoreInteractions(redisClient);
        assertThat(cache.getIfPresent(1L)).isNull();
    }

    @Test
    @DisplayName("列表按索引升序读取并跳过详情缺失的 id")
    void testList() {
        Set<String> ids = new LinkedHashSet<>(List.of("1", "2", "3"));
        when(redisClient.zrange(INDEX, 0, -1)).thenReturn(ids);
        when(redisClient.hmget(INFO, List.of("1", "2", "3"))).thenReturn(Arrays.asList(
                "{\"id\":1,\"title\":\"A\",\"body\":\"a\"}",
                null,
                "{\"id\":3,\"title\":\"C\",\"body\":\"c\"}"));

        List<Post> posts = store.list();

        assertThat(posts).extracting(Post::getId).containsExactly(1L, 3L);
        assertThat(posts).extracting(Post::getTitle).containsExactly("A", "C");
    }

    @Test
    @DisplayName("列表遇到损坏的详情时抛出 IllegalStateException")
    void testListCorruptRecord() {
        when(redisClient.zrange(INDEX, 0, -1)).thenReturn(new LinkedHashSet<>(List.of("1", "2")));
        when(redisClient.hmget(INFO, List.of("1", "2"))).thenReturn(Arrays.asList(
                "{\"id\":1,\"title\":\"A\",\"body\":\"a\"}",
                "{broken"));

        assertThatThrownBy(() -> store.list()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("空索引返回空列表且不读取详情")
    void testListEmpty() {
        when(redisClient.zrange(INDEX, 0, -1)).thenReturn(Set.of());

        assertThat(store.list()).isEmpty();
        verify(redisClient, never()).hmget(anyString(), anyList());
    }

    @Test
    @DisplayName("详情查询：未命中缓存时读取 Redis 并回填")
    void testFindLoadsAndCaches() {
        when(redisClient.hget(INFO, "5")).thenReturn("{\"id\":5,\"title\":\"E\",\"body\":\"e\"}");

        Optional<Post> first = store.find(5L);
        Optional<Post> second = store.find(5L);

        assertThat(first).contains(new Post(5L, "E", "e"));
        assertThat(second).contains(new Post(5L, "E", "e"));
        verify(redisClient, times(1)).hget(INFO, "5");
    }

    @Test
    @DisplayName("详情查询：不存在时返回空且不缓存")
    void testFindMissing() {
        when(redisClient.hget(INFO, "7")).thenReturn(null);

        assertThat(store.find(7L)).isEmpty();
        assertThat(store.find(7L)).isEmpty();
        verify(redisClient, times(2)).hget(INFO, "7");
    }

    @Test
    @DisplayName("详情查询：存储内容损坏时抛出 IllegalStateException 而不是返回空")
    void testFindCorruptRecord() {
        when(redisClient.hget(INFO, "1")).thenReturn("{broken");

        assertThatThrownBy(() -> store.find(1L)).isInstanceOf(IllegalStateException.class);
        assertThat(cache.getIfPresent(1L)).isNull();
    }

    @Test
    @DisplayName("清表删除三类键并清空缓存")
    void testDropSchema() {
        cache.put(1L, new Post(1L, "A", "a"));
        when(redisClient.del(SEQ, INFO, INDEX)).thenReturn(3L);

        store.dropSchema();

        verify(redisClient).del(SEQ, INFO, INDEX);
        assertThat(cache.getIfPresent(1L)).isNull();
    }
}

package com.hao.posts.common.model;

import com.hao.posts.dal.model.Post;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 查询条件测试
 */
class PostQueryTest {

    private final Post post = new Post(1L, "Post with Green Eggs", "Still a test");

    @Test
    @DisplayName("无参数时不产生谓词，匹配全部")
    void testUnfiltered() {
        PostQuery query = PostQuery.of(null, null);

        assertSame(PostQuery.all(), query);
        assertTrue(query.isUnfiltered());
        assertTrue(query.matches(post));
    }

    @Test
    @DisplayName("每个参数生成一个谓词")
    void testPredicatePerParameter() {
        assertEquals(1, PostQuery.of("eggs", null).getPredicates().size());
        assertEquals(1, PostQuery.of(null, "test").getPredicates().size());
        assertEquals(2, PostQuery.of("eggs", "test").getPredicates().size());
    }

    @Test
    @DisplayName("忽略大小写的子串匹配")
    void testCaseInsensitiveContains() {
        assertTrue(PostQuery.of("green eggs", null).matches(post));
        assertTrue(PostQuery.of(null, "STILL").matches(post));
        assertTrue(PostQuery.of("", "").matches(post));
        assertFalse(PostQuery.of("ham", null).matches(post));
    }

    @Test
    @DisplayName("正则与通配符字符按字面匹配")
    void testLiteralMatching() {
        assertFalse(PostQuery.of("Post.*Eggs", null).matches(post));
        assertFalse(PostQuery.of("%", null).matches(post));
        assertTrue(PostQuery.of("%", null).matches(new Post(2L, "100% done", "b")));
    }

    @Test
    @DisplayName("两个条件须同时满足")
    void testAndComposition() {
        assertTrue(PostQuery.of("green", "still").matches(post));
        assertFalse(PostQuery.of("green", "another").matches(post));
        assertFalse(PostQuery.of("ham", "still").matches(post));
    }

    @Test
    @DisplayName("字段为 null 时不匹配对应条件")
    void testNullField() {
        Post noBody = new Post(3L, "title", null);

        assertTrue(PostQuery.of("title", null).matches(noBody));
        assertFalse(PostQuery.of(null, "x").matches(noBody));
    }
}

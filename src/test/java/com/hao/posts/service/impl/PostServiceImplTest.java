package com.hao.posts.service.impl;

import com.hao.posts.common.exception.PostNotFoundException;
import com.hao.posts.common.model.PostCreateRequest;
import com.hao.posts.common.model.PostQuery;
import com.hao.posts.dal.dao.PostStore;
import com.hao.posts.dal.model.Post;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

/**
 * 帖子业务服务测试
 *
 * 测试目的：
 * 1. 验证过滤条件的逻辑与组合、顺序保持。
 * 2. 验证按 id 查询的不存在分支与非整数 id 处理。
 * 3. 验证每个操作只调用一次存储。
 */
@ExtendWith(MockitoExtension.class)
class PostServiceImplTest {

    @Mock
    private PostStore postStore;

    @InjectMocks
    private PostServiceImpl postService;

    private static final List<Post> POSTS = List.of(
            new Post(1L, "Green eggs and ham", "A post by Sam I Am about my favorite foods"),
            new Post(2L, "Green fish blue fish", "A post about Sam I Am's fish bowl"),
            new Post(3L, "Green is my favorite color", "A post by James about how much I love the color green"),
            new Post(4L, "The Cat in the Hat", "A post by Sam I Am about my greatest rival for power"));

    @Test
    @DisplayName("无过滤条件时原样返回存储结果")
    void testListWithoutFilters() {
        when(postStore.list()).thenReturn(POSTS);

        assertThat(postService.listPosts(PostQuery.all())).isEqualTo(POSTS);
        verify(postStore, times(1)).list();
        verifyNoMoreInteractions(postStore);
    }

    @Test
    @DisplayName("单条件过滤保持 id 升序")
    void testListWithTitleFilter() {
        when(postStore.list()).thenReturn(POSTS);

        List<Post> result = postService.listPosts(PostQuery.of("GREEN", null));

        assertThat(result).extracting(Post::getId).containsExactly(1L, 2L, 3L);
    }

    @Test
    @DisplayName("两个条件按逻辑与组合")
    void testListWithBothFilters() {
        when(postStore.list()).thenReturn(POSTS);

        List<Post> result = postService.listPosts(PostQuery.of("green", "Sam"));

        assertThat(result).extracting(Post::getId).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("空存储返回空列表")
    void testListEmptyStore() {
        when(postStore.list()).thenReturn(List.of());

        assertThat(postService.listPosts(PostQuery.of("x", "y"))).isEmpty();
    }

    @Test
    @DisplayName("按 id 查询命中")
    void testGetPost() {
        when(postStore.find(2L)).thenReturn(Optional.of(POSTS.get(1)));

        assertThat(postService.getPost("2")).isEqualTo(POSTS.get(1));
    }

    @Test
    @DisplayName("按 id 查询未命中抛出不存在异常")
    void testGetPostMissing() {
        when(postStore.find(9L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> postService.getPost("9"))
                .isInstanceOf(PostNotFoundException.class)
                .hasMessage("Could not find post with id 9");
    }

    @Test
    @DisplayName("非整数 id 不访问存储直接视为不存在")
    void testGetPostNonNumeric() {
        assertThatThrownBy(() -> postService.getPost("1.5"))
                .isInstanceOf(PostNotFoundException.class)
                .hasMessage("Could not find post with id 1.5");
        verifyNoInteractions(postStore);
    }

    @Test
    @DisplayName("创建只传递标题与正文")
    void testCreatePost() {
        Post created = new Post(1L, "Example Post", "Just a test");
        when(postStore.create("Example Post", "Just a test")).thenReturn(created);

        Post result = postService.createPost(new PostCreateRequest("Example Post", "Just a test"));

        assertThat(result).isEqualTo(created);
        verify(postStore).create("Example Post", "Just a test");
        verifyNoMoreInteractions(postStore);
    }

    @Test
    @DisplayName("存储故障原样上抛，不转换为帖子不存在")
    void testGetPostStoreFailure() {
        when(postStore.find(1L)).thenThrow(new IllegalStateException("JSON 反序列化失败: Post"));

        assertThatThrownBy(() -> postService.getPost("1"))
                .isInstanceOf(IllegalStateException.class)
                .isNotInstanceOf(PostNotFoundException.class);
    }
}

package com.hao.posts.service.impl;

import com.google.common.primitives.Longs;
import com.hao.posts.common.exception.PostNotFoundException;
import com.hao.posts.common.model.PostCreateRequest;
import com.hao.posts.common.model.PostQuery;
import com.hao.posts.dal.dao.PostStore;
import com.hao.posts.dal.model.Post;
import com.hao.posts.service.PostService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 帖子业务服务实现
 *
 * 类职责：
 * 实现列表过滤、按 id 查询与创建逻辑，把存储结果转换为业务结果或业务异常。
 *
 * 核心实现思路：
 * - 过滤在内存中对完整列表执行，谓词由 PostQuery 按参数生成，逻辑与组合。
 * - 查询不到的 id 以 PostNotFoundException 表达，属于预期内结果。
 * - 创建只取 title 与 body，id 由存储分配。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostServiceImpl implements PostService {

    private final PostStore postStore;

    @Override
    public List<Post> listPosts(PostQuery query) {
        List<Post> posts = postStore.list();
        if (query.isUnfiltered()) {
            return posts;
        }
        List<Post> matched = posts.stream()
                .filter(query::matches)
                .toList();
        log.debug("帖子列表过滤|Post_list_filtered,query={},total={},matched={}", query, posts.size(), matched.size());
        return matched;
    }

    /**
     * 按 id 查询帖子
     *
     * 实现逻辑：
     * 1. 原始 id 不是合法整数时直接视为不存在，不访问存储。
     * 2. 存储中查不到时抛出不存在异常，提示中回显原始 id。
     */
    @Override
    public Post getPost(String rawId) {
        Long id = rawId == null ? null : Longs.tryParse(rawId);
        if (id == null) {
            throw new PostNotFoundException(rawId);
        }
        return postStore.find(id).orElseThrow(() -> new PostNotFoundException(rawId));
    }

    @Override
    public Post createPost(PostCreateRequest request) {
        Post created = postStore.create(request.getTitle(), request.getBody());
        log.info("帖子创建成功|Post_created,id={}", created.getId());
        return created;
    }
}

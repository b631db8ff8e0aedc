package com.hao.posts.service;

import com.hao.posts.common.model.PostCreateRequest;
import com.hao.posts.common.model.PostQuery;
import com.hao.posts.dal.model.Post;

import java.util.List;

/**
 * 帖子业务服务接口
 *
 * 类职责：
 * 提供帖子列表（含子串过滤）、按 id 查询与创建能力。
 *
 * 设计目的：
 * 1. 保持控制层与存储层解耦。
 * 2. 每个操作至多调用一次存储，不持有请求间状态。
 */
public interface PostService {

    /**
     * 查询帖子列表
     *
     * 实现逻辑：
     * 1. 读取全部帖子（id 升序）。
     * 2. 按查询条件中的谓词依次过滤，保持原有顺序。
     *
     * @param query 查询条件
     * @return 满足条件的帖子，无数据时为空列表
     */
    List<Post> listPosts(PostQuery query);

    /**
     * 按 id 查询帖子
     *
     * @param rawId 路径中的原始 id 文本
     * @return 帖子
     * @throws com.hao.posts.common.exception.PostNotFoundException id 非整数或不存在时抛出
     */
    Post getPost(String rawId);

    /**
     * 创建帖子
     *
     * @param request 创建请求，只使用 title 与 body
     * @return 带有新分配 id 的帖子
     */
    Post createPost(PostCreateRequest request);
}

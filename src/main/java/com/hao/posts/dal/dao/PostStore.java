package com.hao.posts.dal.dao;

import com.hao.posts.dal.model.Post;

import java.util.List;
import java.util.Optional;

/**
 * 帖子存储接口
 *
 * 类职责：
 * 定义帖子记录的持久化访问入口，业务层只通过该接口读写帖子。
 *
 * 设计目的：
 * 1. 存储实现可替换（Redis、内存），便于本地运行与测试。
 * 2. 并发一致性（id 唯一、递增）由存储实现自身保证，业务层不加锁。
 *
 * 核心实现思路：
 * - list 按 id 升序返回全部帖子。
 * - create 分配下一个可用 id，id 从不复用。
 * - createSchema / dropSchema 提供显式生命周期，测试前后建表与清表。
 */
public interface PostStore {

    /**
     * 读取全部帖子
     *
     * @return 按 id 升序排列的帖子列表，无数据时为空列表
     */
    List<Post> list();

    /**
     * 按 id 查询帖子
     *
     * @param id 帖子ID
     * @return 帖子，不存在时为空
     */
    Optional<Post> find(long id);

    /**
     * 创建帖子
     *
     * @param title 标题
     * @param body 正文
     * @return 带有新分配 id 的帖子
     */
    Post create(String title, String body);

    /**
     * 初始化存储结构
     */
    void createSchema();

    /**
     * 删除全部帖子与 id 序列
     */
    void dropSchema();
}

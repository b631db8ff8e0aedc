package com.hao.posts.dal.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 帖子实体
 *
 * 类职责：
 * 描述帖子的标识、标题与正文，用于存储序列化与接口返回。
 *
 * 设计目的：
 * 1. 统一帖子数据结构，存储层与接口层共用同一模型。
 * 2. 固定 JSON 字段顺序（id、title、body），便于客户端阅读。
 *
 * 核心实现思路：
 * - id 由存储层在创建时分配，此后不可变。
 * - 通过 Lombok 降低样板代码。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonPropertyOrder({"id", "title", "body"})
public class Post {

    /** 帖子ID（存储层单调分配，从 1 开始） */
    private Long id;

    /** 标题 */
    private String title;

    /** 正文 */
    private String body;
}

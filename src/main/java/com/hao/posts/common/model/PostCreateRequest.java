package com.hao.posts.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创建帖子请求体
 *
 * 类职责：
 * 承载客户端提交的标题与正文。
 *
 * 核心实现思路：
 * - 只声明 title 与 body，客户端携带的 id 等其它字段一律忽略。
 * - 仅校验字段存在，不校验内容长度。
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostCreateRequest {

    @NotNull(message = "must not be null")
    private String title;

    @NotNull(message = "must not be null")
    private String body;
}

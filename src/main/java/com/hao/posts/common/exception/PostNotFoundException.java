package com.hao.posts.common.exception;

import com.hao.posts.common.constants.PostConstants;
import lombok.Getter;

/**
 * 帖子不存在异常
 *
 * 类职责：
 * 标识按 id 查询时存储中没有对应记录，由 GlobalExceptionHandler 转换为 HTTP 404。
 *
 * 实现思路：
 * - 保存请求中的原始 id 文本，错误提示原样回显，不做加引号或格式化。
 * - 属于预期内结果，不携带堆栈以外的上下文。
 */
@Getter
public class PostNotFoundException extends RuntimeException {

    /** 请求中的原始 id */
    private final String requestedId;

    public PostNotFoundException(String requestedId) {
        super(String.format(PostConstants.POST_NOT_FOUND_TEMPLATE, requestedId));
        this.requestedId = requestedId;
    }

    public PostNotFoundException(long requestedId) {
        this(String.valueOf(requestedId));
    }
}

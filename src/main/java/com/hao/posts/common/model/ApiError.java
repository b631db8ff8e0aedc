package com.hao.posts.common.model;

/**
 * 统一错误响应体，序列化后固定为 {"message": "..."}。
 *
 * @param message 错误提示
 */
public record ApiError(String message) {
}

package com.hao.posts.common.exception;

import com.hao.posts.common.constants.PostConstants;
import lombok.Getter;

/**
 * 内容协商失败异常
 *
 * 类职责：
 * 请求的 Accept 头不接受 application/json 时由协商拦截器抛出，
 * 配合 GlobalExceptionHandler 返回 HTTP 406。
 */
@Getter
public class NotAcceptableException extends RuntimeException {

    /** 请求中的原始 Accept 头，可能为 null */
    private final String acceptHeader;

    public NotAcceptableException(String acceptHeader) {
        super(PostConstants.NOT_ACCEPTABLE_MESSAGE);
        this.acceptHeader = acceptHeader;
    }
}

package com.hao.posts.common.interceptor;

import com.hao.posts.common.exception.NotAcceptableException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.Collections;
import java.util.List;

/**
 * 内容协商拦截器
 *
 * 类职责：
 * 在进入任何帖子接口之前检查请求的 Accept 头，不接受 application/json 的请求直接拒绝。
 *
 * 设计目的：
 * 1. 内容协商是横切能力，集中在拦截器处理，接口方法内不重复校验。
 * 2. 拒绝发生在 Controller 调用之前，被拒请求不会访问存储层。
 *
 * 核心实现思路：
 * - 缺失或空白的 Accept 视同 *&#47;*。
 * - 取能匹配 application/json 的最具体媒体范围，其 q 值大于 0 才算接受。
 * - 无法解析的 Accept 视为不接受。
 * - 拒绝时抛出 NotAcceptableException，由 GlobalExceptionHandler 统一输出 406。
 */
@Slf4j
@Component
public class AcceptJsonInterceptor implements HandlerInterceptor {

    /**
     * 拦截请求并校验 Accept
     *
     * @param request 请求对象
     * @param response 响应对象
     * @param handler 处理器对象
     * @return 接受 JSON 时放行
     */
    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String accept = readAcceptHeader(request);
        if (!acceptsJson(accept)) {
            throw new NotAcceptableException(accept);
        }
        return true;
    }

    /**
     * 判断 Accept 头是否接受 application/json
     *
     * 实现逻辑：
     * 1. 空值直接放行。
     * 2. 解析媒体范围列表，解析失败视为不接受。
     * 3. 在所有包含 application/json 的范围中选出最具体的一个，按其 q 值判定。
     *
     * @param accept Accept 头原文，可为 null
     * @return 是否接受 JSON
     */
    static boolean acceptsJson(String accept) {
        if (!StringUtils.hasText(accept)) {
            return true;
        }
        List<MediaType> mediaTypes;
        try {
            mediaTypes = MediaType.parseMediaTypes(accept);
        } catch (InvalidMediaTypeException e) {
            log.debug("Accept头解析失败|Accept_header_invalid,accept={},message={}", accept, e.getMessage());
            return false;
        }
        MediaType best = null;
        for (MediaType mediaType : mediaTypes) {
            if (!mediaType.includes(MediaType.APPLICATION_JSON)) {
                continue;
            }
            if (best == null || specificity(mediaType) > specificity(best)) {
                best = mediaType;
            }
        }
        return best != null && best.getQualityValue() > 0;
    }

    private static int specificity(MediaType mediaType) {
        if (mediaType.isWildcardType()) {
            return 0;
        }
        return mediaType.isWildcardSubtype() ? 1 : 2;
    }

    /**
     * 读取 Accept 头，多个同名头按逗号合并
     */
    private static String readAcceptHeader(HttpServletRequest request) {
        List<String> values = Collections.list(request.getHeaders(HttpHeaders.ACCEPT));
        if (values.isEmpty()) {
            return null;
        }
        return String.join(",", values);
    }
}

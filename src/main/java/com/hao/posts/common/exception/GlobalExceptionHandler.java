package com.hao.posts.common.exception;

import com.hao.posts.common.constants.PostConstants;
import com.hao.posts.common.model.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;

import java.util.Comparator;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 *
 * 类职责：
 * 统一捕获 Controller 层与拦截器抛出的异常，转换为 {"message": "..."} 格式的 JSON 响应。
 *
 * 设计目的：
 * 1. 所有错误响应的媒体类型固定为 application/json，与客户端 Accept 无关。
 * 2. 区分预期内结果（404、406）与系统异常，日志级别分级记录。
 *
 * 实现思路：
 * - 使用 @RestControllerAdvice 拦截所有 Controller 异常。
 * - 返回 ResponseEntity 并预置 Content-Type，跳过消息转换器的内容协商，
 *   否则 Accept: application/xml 的请求无法写出 406 响应体。
 * - 使用 Exception 作为兜底策略，框架自带的 ErrorResponse 类异常保留其原始状态码。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理内容协商失败
     *
     * 实现逻辑：
     * 1. 记录 INFO 日志（客户端声明问题，非系统错误）。
     * 2. 返回 HTTP 406 与固定提示。
     *
     * @param e 协商异常
     * @param request 请求上下文
     * @return 标准化错误响应
     */
    @ExceptionHandler(NotAcceptableException.class)
    public ResponseEntity<ApiError> handleNotAcceptable(NotAcceptableException e, WebRequest request) {
        log.info("请求不接受JSON|Not_acceptable,path={},accept={}", getRequestPath(request), e.getAcceptHeader());
        return build(HttpStatus.NOT_ACCEPTABLE, e.getMessage());
    }

    /**
     * 处理帖子不存在
     *
     * 实现逻辑：
     * 1. 记录 INFO 日志，按 id 查不到是正常业务结果，不能按错误级别记录。
     * 2. 返回 HTTP 404，提示中回显原始 id。
     *
     * @param e 不存在异常
     * @param request 请求上下文
     * @return 标准化错误响应
     */
    @ExceptionHandler(PostNotFoundException.class)
    public ResponseEntity<ApiError> handlePostNotFound(PostNotFoundException e, WebRequest request) {
        log.info("帖子不存在|Post_not_found,path={},id={}", getRequestPath(request), e.getRequestedId());
        return build(HttpStatus.NOT_FOUND, e.getMessage());
    }

    /**
     * 处理请求体无法解析（非 JSON、类型错误等）
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException e, WebRequest request) {
        log.warn("请求体解析失败|Request_body_unreadable,path={},message={}", getRequestPath(request), e.getMessage());
        return build(HttpStatus.BAD_REQUEST, PostConstants.MALFORMED_BODY_MESSAGE);
    }

    /**
     * 处理请求体字段缺失
     *
     * 实现逻辑：
     * 1. 收集字段错误，按字段名排序后拼接为 "field: reason"，多个之间用 "; " 分隔。
     * 2. 返回 HTTP 400。
     *
     * @param e 校验异常
     * @param request 请求上下文
     * @return 标准化错误响应
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalid(MethodArgumentNotValidException e, WebRequest request) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .sorted(Comparator.comparing(FieldError::getField))
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.warn("请求参数校验失败|Request_validation_fail,path={},message={}", getRequestPath(request), message);
        return build(HttpStatus.BAD_REQUEST, message);
    }

    /**
     * 处理系统兜底异常
     *
     * 实现逻辑：
     * 1. 框架异常（实现 ErrorResponse，如 405、415、未知路径 404）沿用其状态码与描述，记录 WARN。
     * 2. 其余异常记录 ERROR 级别日志与堆栈，返回 HTTP 500，隐藏具体细节。
     *
     * @param e 未知异常对象
     * @param request 请求上下文
     * @return 标准化错误响应
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleException(Exception e, WebRequest request) {
        if (e instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("框架请求异常|Framework_request_error,path={},status={},message={}",
                    getRequestPath(request), status.value(), e.getMessage());
            return build(status, describe(errorResponse, status));
        }
        log.error("系统未知异常|System_unknown_error,path={},message={}", getRequestPath(request), e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, PostConstants.INTERNAL_ERROR_MESSAGE);
    }

    private ResponseEntity<ApiError> build(HttpStatusCode status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ApiError(message));
    }

    private String describe(ErrorResponse errorResponse, HttpStatusCode status) {
        ProblemDetail body = errorResponse.getBody();
        if (body.getDetail() != null) {
            return body.getDetail();
        }
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : String.valueOf(status.value());
    }

    /**
     * 提取纯净的请求路径
     *
     * WebRequest.getDescription(false) 返回格式通常为 "uri=/path"，去除 "uri=" 前缀保持日志整洁。
     */
    private String getRequestPath(WebRequest request) {
        return request.getDescription(false).replace("uri=", "");
    }
}

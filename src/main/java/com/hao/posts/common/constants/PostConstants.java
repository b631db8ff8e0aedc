package com.hao.posts.common.constants;

/**
 * 帖子接口常量定义
 *
 * 类职责：
 * 集中管理接口路径、查询参数名与固定错误提示，避免魔法字符串散落在各层。
 */
public class PostConstants {

    /** 内容协商拦截范围 */
    public static final String API_PATH_PATTERN = "/api/**";

    /** 帖子集合路径 */
    public static final String POSTS_PATH = "/api/posts";

    /** 标题子串过滤参数 */
    public static final String TITLE_LIKE_PARAM = "title_like";

    /** 正文子串过滤参数 */
    public static final String BODY_LIKE_PARAM = "body_like";

    /** 406 固定提示 */
    public static final String NOT_ACCEPTABLE_MESSAGE = "Request must accept application/json data";

    /** 404 提示模板，参数为请求中的原始 id */
    public static final String POST_NOT_FOUND_TEMPLATE = "Could not find post with id %s";

    public static final String MALFORMED_BODY_MESSAGE = "Malformed JSON request body";

    public static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private PostConstants() {
        // 禁止实例化
    }
}

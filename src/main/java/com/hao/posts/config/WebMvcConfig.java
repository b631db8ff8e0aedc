package com.hao.posts.config;

import com.hao.posts.common.constants.PostConstants;
import com.hao.posts.common.interceptor.AcceptJsonInterceptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web 拦截器配置类
 *
 * 类职责：
 * 统一注册系统内的拦截器并配置拦截路径规则。
 *
 * 为什么需要该类：
 * 拦截器需要在 WebMvcConfigurer 中显式注册才能生效，缺少统一配置会导致协商校验失效。
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private AcceptJsonInterceptor acceptJsonInterceptor;

    /**
     * 注册拦截器链
     *
     * 实现逻辑：
     * 1. 内容协商拦截器覆盖 /api 下的全部路径，包括未映射的路径。
     *
     * @param registry 拦截器注册器
     */
    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(acceptJsonInterceptor)
                .addPathPatterns(PostConstants.API_PATH_PATTERN);
    }
}

package com.hao.posts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 帖子服务启动入口
 *
 * 类职责：
 * 负责引导 Spring Boot 应用启动与组件扫描。
 *
 * 核心实现思路：
 * - 组合 @SpringBootApplication 完成自动配置与组件扫描。
 * - 存储实现由 posts.store.type 决定，启动类本身不感知。
 */
@SpringBootApplication
public class PostsApplication {

    /**
     * 应用主入口
     *
     * @param args 命令行参数
     */
    public static void main(String[] args) {
        SpringApplication.run(PostsApplication.class, args);
    }
}

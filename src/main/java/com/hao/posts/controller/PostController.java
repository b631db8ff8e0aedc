package com.hao.posts.controller;

import com.hao.posts.common.constants.PostConstants;
import com.hao.posts.common.model.PostCreateRequest;
import com.hao.posts.common.model.PostQuery;
import com.hao.posts.dal.model.Post;
import com.hao.posts.service.PostService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

import java.net.URI;
import java.util.List;

/**
 * 帖子接口控制器
 *
 * 类职责：
 * 提供帖子列表、详情与创建接口，负责参数接收与请求转发。
 *
 * 设计目的：
 * 1. 统一 HTTP 入口，保持控制层轻量。
 * 2. 内容协商由拦截器完成，错误响应由全局异常处理器输出，接口方法只处理成功路径。
 */
@RestController
@RequestMapping(PostConstants.POSTS_PATH)
@RequiredArgsConstructor
public class PostController {

    private final PostService postService;

    /**
     * 获取帖子列表
     *
     * 实现逻辑：
     * 1. 接收可选的标题、正文子串参数，缺省表示不过滤。
     * 2. 调用服务层按 id 升序返回结果。
     *
     * @param titleLike 标题子串
     * @param bodyLike 正文子串
     * @return 帖子列表
     */
    @GetMapping
    public List<Post> listPosts(@RequestParam(name = PostConstants.TITLE_LIKE_PARAM, required = false) String titleLike,
                                @RequestParam(name = PostConstants.BODY_LIKE_PARAM, required = false) String bodyLike) {
        return postService.listPosts(PostQuery.of(titleLike, bodyLike));
    }

    /**
     * 获取单个帖子
     *
     * @param id 路径中的帖子ID，原样交给服务层解析
     * @return 帖子详情
     */
    @GetMapping("/{id}")
    public Post getPost(@PathVariable("id") String id) {
        return postService.getPost(id);
    }

    /**
     * 创建帖子
     *
     * 实现逻辑：
     * 1. 校验 title 与 body 存在。
     * 2. 调用服务层创建并取得分配的 id。
     * 3. 返回 201，Location 指向 /api/posts/{id}。
     *
     * @param request 创建请求
     * @return 新建帖子
     */
    @PostMapping
    public ResponseEntity<Post> createPost(@Valid @RequestBody PostCreateRequest request) {
        Post created = postService.createPost(request);
        URI location = ServletUriComponentsBuilder.fromCurrentRequestUri()
                .path("/{id}")
                .buildAndExpand(created.getId())
                .toUri();
        return ResponseEntity.created(location).body(created);
    }
}

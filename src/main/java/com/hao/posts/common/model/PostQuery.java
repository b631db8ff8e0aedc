package com.hao.posts.common.model;

import com.hao.posts.dal.model.Post;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * 帖子列表查询条件
 *
 * 类职责：
 * 将可选的 title_like / body_like 参数转换为有序的过滤谓词列表。
 *
 * 设计目的：
 * 1. 每个可选参数对应一个谓词，参数组合不需要逐一分支处理。
 * 2. 谓词之间按逻辑与组合，缺省参数不产生约束。
 *
 * 核心实现思路：
 * - 匹配规则为忽略大小写的字面子串包含，不支持通配符或正则。
 * - 谓词只做筛选，不改变原有的 id 升序。
 */
@Getter
public final class PostQuery {

    private static final PostQuery ALL = new PostQuery(null, null);

    /** 标题子串，null 表示不过滤 */
    private final String titleLike;

    /** 正文子串，null 表示不过滤 */
    private final String bodyLike;

    private final List<Predicate<Post>> predicates;

    private PostQuery(String titleLike, String bodyLike) {
        this.titleLike = titleLike;
        this.bodyLike = bodyLike;
        List<Predicate<Post>> list = new ArrayList<>(2);
        if (titleLike != null) {
            list.add(containsIgnoreCase(Post::getTitle, titleLike));
        }
        if (bodyLike != null) {
            list.add(containsIgnoreCase(Post::getBody, bodyLike));
        }
        this.predicates = Collections.unmodifiableList(list);
    }

    /**
     * 构建查询条件
     *
     * @param titleLike 标题子串，可为 null
     * @param bodyLike  正文子串，可为 null
     * @return 查询条件
     */
    public static PostQuery of(String titleLike, String bodyLike) {
        if (titleLike == null && bodyLike == null) {
            return ALL;
        }
        return new PostQuery(titleLike, bodyLike);
    }

    public static PostQuery all() {
        return ALL;
    }

    /**
     * 是否不带任何过滤条件
     */
    public boolean isUnfiltered() {
        return predicates.isEmpty();
    }

    /**
     * 判断帖子是否满足全部过滤条件（逻辑与）
     *
     * @param post 帖子
     * @return 全部谓词通过时返回 true；无谓词时恒为 true
     */
    public boolean matches(Post post) {
        for (Predicate<Post> predicate : predicates) {
            if (!predicate.test(post)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 构造单字段的忽略大小写子串谓词
     *
     * @param field  字段读取函数
     * @param needle 待查找子串
     * @return 谓词；字段为 null 时不匹配
     */
    static Predicate<Post> containsIgnoreCase(Function<Post, String> field, String needle) {
        String foldedNeedle = needle.toLowerCase(Locale.ROOT);
        return post -> {
            String value = field.apply(post);
            return value != null && value.toLowerCase(Locale.ROOT).contains(foldedNeedle);
        };
    }

    @Override
    public String toString() {
        return "PostQuery(titleLike=" + titleLike + ", bodyLike=" + bodyLike + ")";
    }
}

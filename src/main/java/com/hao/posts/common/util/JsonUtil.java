package com.hao.posts.common.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON 工具类
 *
 * 类职责：
 * 提供存储层对象与 JSON 字符串之间的转换。
 *
 * 核心实现思路：
 * - 共享一个线程安全的 ObjectMapper，忽略未知字段，兼容旧数据。
 * - 序列化与反序列化失败均抛出 IllegalStateException，存储数据损坏不能被当作数据缺失。
 */
@Slf4j
public final class JsonUtil {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonUtil() {
        // 禁止实例化
    }

    /**
     * 对象序列化为 JSON
     *
     * @param value 待序列化对象
     * @return JSON 字符串
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON 序列化失败: " + value.getClass().getSimpleName(), e);
        }
    }

    /**
     * JSON 反序列化为对象
     *
     * @param json JSON 字符串
     * @param type 目标类型
     * @return 目标对象，json 为 null 时返回 null
     * @throws IllegalStateException json 无法解析为目标类型
     */
    public static <T> T toBean(String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.error("JSON反序列化失败|Json_deserialize_fail,type={},message={}", type.getSimpleName(), e.getOriginalMessage());
            throw new IllegalStateException("JSON 反序列化失败: " + type.getSimpleName(), e);
        }
    }
}

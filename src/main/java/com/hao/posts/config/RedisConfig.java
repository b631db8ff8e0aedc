package com.hao.posts.config;

import com.hao.posts.integration.redis.RedisClient;
import com.hao.posts.integration.redis.RedisClientImpl;
import io.lettuce.core.api.StatefulConnection;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Redis 配置类
 * <p>
 * 类职责：
 * 构建 Lettuce 连接工厂、模板与自定义客户端封装，仅在 posts.store.type=redis 时生效。
 *
 * 设计目的：
 * 1. 统一 Redis 连接与连接池配置，避免多处重复。
 * 2. 帖子存储只依赖 RedisClient 接口，不直接接触模板。
 *
 * 核心实现思路：
 * - 读取 Spring Boot 的 RedisProperties 组装单机节点与连接池配置。
 * - 显式关闭连接共享，配合连接池提升并发吞吐。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RedisProperties.class)
@ConditionalOnProperty(name = "posts.store.type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    private final RedisProperties redisProperties;

    public RedisConfig(RedisProperties redisProperties) {
        this.redisProperties = redisProperties;
    }

    /**
     * 创建并配置 Lettuce 连接工厂
     *
     * 实现逻辑：
     * 1. 读取节点地址、密码与库号。
     * 2. 构建连接池参数与客户端配置。
     * 3. 关闭连接共享并实例化连接工厂。连接在首次命令时建立，启动阶段不访问 Redis。
     *
     * @return LettuceConnectionFactory 配置好的连接工厂
     */
    @Bean
    public LettuceConnectionFactory redisConnectionFactory() {
        // --- 1. 单机节点信息 ---
        RedisStandaloneConfiguration config = new RedisStandaloneConfiguration(
                redisProperties.getHost(), redisProperties.getPort());
        config.setDatabase(redisProperties.getDatabase());
        if (StringUtils.hasText(redisProperties.getPassword())) {
            config.setPassword(redisProperties.getPassword());
        }

        // --- 2. 连接池参数 (GenericObjectPool) ---
        GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig = new GenericObjectPoolConfig<>();
        RedisProperties.Pool pool = redisProperties.getLettuce().getPool();
        if (pool != null) {
            poolConfig.setMaxTotal(pool.getMaxActive());
            poolConfig.setMaxIdle(pool.getMaxIdle());
            poolConfig.setMinIdle(pool.getMinIdle());
            poolConfig.setMaxWait(pool.getMaxWait());
        }

        // 默认命令超时 5 秒
        Duration timeout = redisProperties.getTimeout() != null ? redisProperties.getTimeout() : Duration.ofSeconds(5);

        // --- 3. 客户端配置 ---
        LettuceClientConfiguration clientConfiguration = LettucePoolingClientConfiguration.builder()
                .commandTimeout(timeout)
                .poolConfig(poolConfig)
                .build();

        LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(config, clientConfiguration);
        connectionFactory.setValidateConnection(true);
        // 关闭连接共享：每次操作从连接池获取独立物理连接
        connectionFactory.setShareNativeConnection(false);
        log.info("Redis连接工厂创建完成|Redis_factory_created,host={},port={},database={},poolMax={}",
                redisProperties.getHost(), redisProperties.getPort(), redisProperties.getDatabase(),
                poolConfig.getMaxTotal());
        return connectionFactory;
    }

    /**
     * 配置 StringRedisTemplate，键和值都使用 String 序列化。
     */
    @Bean
    public StringRedisTemplate stringRedisTemplate(LettuceConnectionFactory connectionFactory) {
        StringRedisTemplate template = new StringRedisTemplate();
        template.setConnectionFactory(connectionFactory);
        template.afterPropertiesSet();
        return template;
    }

    /**
     * 配置自定义的 RedisClient 封装类
     *
     * @param stringRedisTemplate Redis 模板
     * @return RedisClient 客户端封装
     */
    @Bean
    public RedisClient<String> redisClient(StringRedisTemplate stringRedisTemplate) {
        return new RedisClientImpl(stringRedisTemplate);
    }
}

package com.hao.posts.common.aspect;

import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 存储访问监控切面
 *
 * 类职责：
 * 统计每次 PostStore 调用的耗时，超过阈值时输出告警日志。
 *
 * 设计目的：
 * - 存储调用是每个请求唯一的阻塞点，耗时可观测便于定位慢请求。
 * - 监控逻辑不侵入存储实现。
 *
 * 核心实现思路：
 * - 使用 AOP 环绕 PostStore 接口的所有方法。
 * - 正常耗时记录 DEBUG，超过 posts.store.slow-threshold-ms 记录 WARN。
 * - 异常原样抛出，由上层统一处理。
 */
@Slf4j
@Aspect
@Component
public class PostStoreMonitorAspect {

    @Value("${posts.store.slow-threshold-ms:200}")
    private long slowThresholdMs;

    @Pointcut("execution(public * com.hao.posts.dal.dao.PostStore.*(..))")
    public void storeMethods() {
    }

    @Around("storeMethods()")
    public Object monitor(ProceedingJoinPoint joinPoint) throws Throwable {
        String method = joinPoint.getSignature().getName();
        long start = System.nanoTime();
        try {
            return joinPoint.proceed();
        } finally {
            long costMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (costMs > slowThresholdMs) {
                log.warn("存储慢调用|Store_slow_call,method={},costMs={},thresholdMs={}", method, costMs, slowThresholdMs);
            } else {
                log.debug("存储调用耗时|Store_call_cost,method={},costMs={}", method, costMs);
            }
        }
    }
}

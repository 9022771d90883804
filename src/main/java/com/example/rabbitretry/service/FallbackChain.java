package com.example.rabbitretry.service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BooleanSupplier;

import lombok.extern.slf4j.Slf4j;

/**
 * 有序的兜底步骤
 * 
 * 按顺序执行，第一个成功的步骤结束整个链；
 * 全部失败时返回 REPORTED_LOSS，表示消息已丢失并已记录
 */
@Slf4j
public final class FallbackChain {

    public static final String REPORTED_LOSS = "REPORTED_LOSS";

    private final Map<String, BooleanSupplier> steps = new LinkedHashMap<>();

    public static FallbackChain start() {
        return new FallbackChain();
    }

    public FallbackChain then(String name, BooleanSupplier step) {
        steps.put(name, step);
        return this;
    }

    /**
     * @return 成功的步骤名，全部失败时为 REPORTED_LOSS
     */
    public String run() {
        for (Map.Entry<String, BooleanSupplier> step : steps.entrySet()) {
            boolean succeeded;
            try {
                succeeded = step.getValue().getAsBoolean();
            } catch (RuntimeException e) {
                log.error("✗ [Fallback] 步骤执行异常: {}", step.getKey(), e);
                succeeded = false;
            }
            if (succeeded) {
                return step.getKey();
            }
            log.warn("⚠ [Fallback] 步骤未成功: {}", step.getKey());
        }
        log.error("☠ [Fallback] 所有步骤都失败，消息丢失: steps={}", steps.keySet());
        return REPORTED_LOSS;
    }
}

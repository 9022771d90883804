package com.example.rabbitretry.service;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.example.rabbitretry.config.RetryProperties;
import com.google.common.math.IntMath;

/**
 * 指数退避策略
 * delay(n) = initialDelay * multiplier ^ n（秒）
 */
@Component
public class BackoffPolicy {

    private final int maxRetryAttempts;
    private final int initialRetryDelay;
    private final int backoffMultiplier;

    public BackoffPolicy(RetryProperties properties) {
        this(properties.getMaxRetryAttempts(), properties.getInitialRetryDelay(), properties.getBackoffMultiplier());
    }

    public BackoffPolicy(int maxRetryAttempts, int initialRetryDelay, int backoffMultiplier) {
        checkArgument(maxRetryAttempts >= 0, "max-retry-attempts must not be negative: %s", maxRetryAttempts);
        checkArgument(initialRetryDelay > 0, "initial-retry-delay must be positive: %s", initialRetryDelay);
        checkArgument(backoffMultiplier >= 1, "backoff-multiplier must be at least 1: %s", backoffMultiplier);
        this.maxRetryAttempts = maxRetryAttempts;
        this.initialRetryDelay = initialRetryDelay;
        this.backoffMultiplier = backoffMultiplier;
    }

    /**
     * 第 attemptCount 次重试的延迟
     * 
     * @throws ArithmeticException 延迟超出 int 范围
     */
    public Duration computeDelay(int attemptCount) {
        return Duration.ofSeconds(delaySeconds(attemptCount));
    }

    public int delaySeconds(int attemptCount) {
        checkArgument(attemptCount >= 0, "attemptCount must not be negative: %s", attemptCount);
        return IntMath.checkedMultiply(initialRetryDelay, IntMath.checkedPow(backoffMultiplier, attemptCount));
    }

    /**
     * 是否还可以重试
     */
    public boolean hasRetryBudget(int attemptCount) {
        return attemptCount < maxRetryAttempts;
    }

    /**
     * 从第 0 次到第 maxRetryAttempts 次的延迟（秒），用于巡检已知的延迟队列
     */
    public List<Integer> plannedDelays() {
        List<Integer> delays = new ArrayList<>();
        for (int attempt = 0; attempt <= maxRetryAttempts; attempt++) {
            delays.add(delaySeconds(attempt));
        }
        return delays;
    }

    public int getMaxRetryAttempts() {
        return maxRetryAttempts;
    }
}

package com.example.rabbitretry.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Spring Retry 配置
 * 启用 @Retryable 和 @Recover 注解支持（用于 MessagePublisher 发送重试）
 * 
 * 注意：消费端的延迟重试不走 Spring Retry，而是由 Broker 的 TTL + 死信完成
 */
@Configuration
@EnableRetry
public class RetryConfig {

    /**
     * 死信时间使用的时钟
     */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}

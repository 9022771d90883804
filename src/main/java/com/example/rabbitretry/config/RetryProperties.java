package com.example.rabbitretry.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.constant.RetryConstants;

import lombok.Getter;
import lombok.Setter;

/**
 * 重试 / 死信相关配置
 * 部署时确定，运行期间不会修改
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "rabbit-retry")
public class RetryProperties {

    /** 最大重试次数 */
    private int maxRetryAttempts = RetryConstants.DefaultConfig.MAX_RETRY_ATTEMPTS;

    /** 首次重试延迟（秒） */
    private int initialRetryDelay = RetryConstants.DefaultConfig.INITIAL_RETRY_DELAY_SECONDS;

    /** 退避倍数 */
    private int backoffMultiplier = RetryConstants.DefaultConfig.BACKOFF_MULTIPLIER;

    /** 业务交换机（direct） */
    private String originExchange = "direct_logs";

    /** 消费者监听的队列 */
    private String consumerQueue = "direct_logs.consumer";

    /** 消费者订阅的路由键 */
    private List<String> routingKeys = new ArrayList<>(List.of("info", "warning", "error"));

    /** 死信队列 */
    private String deadLetterQueue = "dead_letter_queue";

    /** 死信原因最大长度（消息头大小限制） */
    private int deathReasonMaxLength = RetryConstants.DefaultConfig.DEATH_REASON_MAX_LENGTH;
}

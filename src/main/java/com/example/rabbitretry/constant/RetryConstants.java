package com.example.rabbitretry.constant;

/**
 * 重试 / 死信相关常量定义
 * 
 * 统一管理消息头、死信原因、默认配置等常量
 */
public class RetryConstants {

    /**
     * 消息头
     * 注意：头部的值只能是整数或字符串，不能放浮点数或 Java 对象
     */
    public static class Headers {
        /** 已重试次数 */
        public static final String RETRY_COUNT = "x-retry-count";

        /** 首次失败时的路由键 */
        public static final String ORIGINAL_ROUTING_KEY = "x-original-routing-key";

        /** 本次重试的延迟（秒） */
        public static final String RETRY_DELAY = "x-retry-delay";

        /**
         * 重试交换机的路由头，值与 x-retry-delay 相同
         * Headers 交换机匹配时忽略 x- 开头的头部，所以不能用 x-retry-delay 绑定
         */
        public static final String HOLDING_DELAY = "retry-holding-delay";

        /** 死信原因 */
        public static final String DEATH_REASON = "x-death-reason";

        /** 进入死信的时间戳（秒） */
        public static final String DEATH_TIMESTAMP = "x-death-timestamp";

        /** 进入死信的时间（ISO-8601） */
        public static final String DEATH_DATETIME = "x-death-datetime";
    }

    /**
     * 死信原因
     */
    public static class DeathReason {
        /** 重试耗尽 */
        public static final String MAX_RETRY_EXCEEDED = "Max retry attempts exceeded";

        /** 发送到延迟队列失败 */
        public static final String RETRY_SCHEDULING_FAILED = "Retry scheduling failed after %d attempts";

        /** 消息体不是合法 JSON */
        public static final String INVALID_JSON_PREFIX = "Invalid JSON: ";

        /** 未分类异常 */
        public static final String UNEXPECTED_ERROR_PREFIX = "Unexpected error: ";
    }

    /**
     * 默认配置
     */
    public static class DefaultConfig {
        /** 默认最大重试次数 */
        public static final int MAX_RETRY_ATTEMPTS = 3;

        /** 默认首次重试延迟（秒） */
        public static final int INITIAL_RETRY_DELAY_SECONDS = 1;

        /** 默认退避倍数 */
        public static final int BACKOFF_MULTIPLIER = 2;

        /** 默认死信原因最大长度 */
        public static final int DEATH_REASON_MAX_LENGTH = 1000;
    }
}

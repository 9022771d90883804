package com.example.rabbitretry.config;

import static com.google.common.base.Preconditions.checkArgument;

import org.springframework.stereotype.Component;

import com.google.common.base.Strings;

/**
 * 重试 / 死信拓扑命名规则
 * 
 * 约定：
 * - 延迟队列：retry_queue_{延迟秒数}s
 * - 重试交换机：{业务交换机}_retry
 * - 死信交换机：{业务交换机}_dlq
 */
@Component
public class RetryTopology {

    private static final String HOLDING_QUEUE_PREFIX = "retry_queue_";

    private final String originExchange;
    private final String deadLetterQueue;
    private final String consumerQueue;

    public RetryTopology(RetryProperties properties) {
        checkArgument(!Strings.isNullOrEmpty(properties.getOriginExchange()),
                "rabbit-retry.origin-exchange must not be empty");
        checkArgument(!Strings.isNullOrEmpty(properties.getDeadLetterQueue()),
                "rabbit-retry.dead-letter-queue must not be empty");
        checkArgument(!Strings.isNullOrEmpty(properties.getConsumerQueue()),
                "rabbit-retry.consumer-queue must not be empty");
        this.originExchange = properties.getOriginExchange();
        this.deadLetterQueue = properties.getDeadLetterQueue();
        this.consumerQueue = properties.getConsumerQueue();
    }

    public String originExchange() {
        return originExchange;
    }

    public String retryExchange() {
        return originExchange + "_retry";
    }

    public String deadLetterExchange() {
        return originExchange + "_dlq";
    }

    public String deadLetterQueue() {
        return deadLetterQueue;
    }

    public String consumerQueue() {
        return consumerQueue;
    }

    /**
     * 延迟队列名只由延迟时间决定，相同延迟的消息共用一个队列
     */
    public String holdingQueueName(long delaySeconds) {
        return HOLDING_QUEUE_PREFIX + delaySeconds + "s";
    }
}

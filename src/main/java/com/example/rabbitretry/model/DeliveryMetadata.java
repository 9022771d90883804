package com.example.rabbitretry.model;

import static com.google.common.base.Preconditions.checkArgument;

import lombok.Value;

/**
 * 投递元数据（重试记账）
 * 随消息头传递，进程内不保存任何重试状态
 * 
 * - attemptCount：已经过重试调度的次数，从 0 开始，只增不减
 * - originalRoutingKey：第一次失败时确定，之后不变
 * - computedDelaySeconds：最近一次重试的延迟，从未重试过时为 null
 */
@Value
public class DeliveryMetadata {

    int attemptCount;

    String originalRoutingKey;

    Integer computedDelaySeconds;

    public DeliveryMetadata(int attemptCount, String originalRoutingKey, Integer computedDelaySeconds) {
        checkArgument(attemptCount >= 0, "attemptCount must not be negative: %s", attemptCount);
        this.attemptCount = attemptCount;
        this.originalRoutingKey = originalRoutingKey;
        this.computedDelaySeconds = computedDelaySeconds;
    }

    /**
     * 第一次投递的元数据
     */
    public static DeliveryMetadata initial(String routingKey) {
        return new DeliveryMetadata(0, routingKey, null);
    }

    /**
     * 下一次重试的元数据：次数 +1，保留原始路由键，记录本次延迟
     */
    public DeliveryMetadata escalate(int delaySeconds) {
        return new DeliveryMetadata(attemptCount + 1, originalRoutingKey, delaySeconds);
    }
}

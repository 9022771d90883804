package com.example.rabbitretry.service;

import static com.google.common.base.Preconditions.checkArgument;

import java.time.Duration;

import org.springframework.amqp.core.Message;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.model.DeliveryMetadata;
import com.example.rabbitretry.model.EscalationResult;
import com.example.rabbitretry.session.BrokerSession;

import lombok.extern.slf4j.Slf4j;

/**
 * 重试调度
 * 
 * 1. 按退避策略计算本次延迟
 * 2. 更新投递元数据：次数 +1，保留原始路由键，记录延迟
 * 3. 交给 DelayedRedelivery 在延迟之后重投
 * 
 * 调用前必须确认还有重试次数（由消费者检查），否则抛出 IllegalArgumentException
 */
@Slf4j
@Component
public class RetryScheduler {

    private final BackoffPolicy backoffPolicy;
    private final DelayedRedelivery redelivery;

    public RetryScheduler(BackoffPolicy backoffPolicy, DelayedRedelivery redelivery) {
        this.backoffPolicy = backoffPolicy;
        this.redelivery = redelivery;
    }

    public EscalationResult escalate(BrokerSession session, Message message, DeliveryMetadata metadata) {
        checkArgument(backoffPolicy.hasRetryBudget(metadata.getAttemptCount()),
                "retry budget exhausted: attemptCount=%s, max=%s",
                metadata.getAttemptCount(), backoffPolicy.getMaxRetryAttempts());

        Duration delay = backoffPolicy.computeDelay(metadata.getAttemptCount());
        DeliveryMetadata next = metadata.escalate(Math.toIntExact(delay.getSeconds()));

        EscalationResult result = redelivery.scheduleRedelivery(session, message, next, delay);
        if (result == EscalationResult.SCHEDULED) {
            log.warn("⟳ [Retry Scheduler] 消息将在 {}s 后重试 (attempt {}/{}), routingKey={}",
                    delay.getSeconds(), next.getAttemptCount(), backoffPolicy.getMaxRetryAttempts(),
                    next.getOriginalRoutingKey());
        }
        return result;
    }
}

package com.example.rabbitretry.consumer;

import java.util.concurrent.atomic.AtomicInteger;

import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.constant.RetryConstants.DeathReason;
import com.example.rabbitretry.model.Classification;
import com.example.rabbitretry.model.DeadLetterOutcome;
import com.example.rabbitretry.model.DeliveryMetadata;
import com.example.rabbitretry.model.Disposition;
import com.example.rabbitretry.model.EscalationResult;
import com.example.rabbitretry.service.BackoffPolicy;
import com.example.rabbitretry.service.DeadLetterSink;
import com.example.rabbitretry.service.DeliveryMetadataCodec;
import com.example.rabbitretry.service.FallbackChain;
import com.example.rabbitretry.service.OutcomeClassifier;
import com.example.rabbitretry.service.RetryScheduler;
import com.example.rabbitretry.session.BrokerSession;
import com.example.rabbitretry.session.ChannelHealthGuard;
import com.example.rabbitretry.session.ChannelSession;
import com.example.rabbitretry.session.GuardResult;
import com.example.rabbitretry.session.GuardedOperation;
import com.rabbitmq.client.Channel;

import lombok.extern.slf4j.Slf4j;

/**
 * 带延迟重试的消息消费者
 * 
 * 每条消息的处理流程：
 * 1. 读取投递元数据，分类消费结果
 * 2. 成功 -> ack
 * 3. 临时失败 -> 还有重试次数则发送到延迟队列，否则进死信；发送延迟队列失败时也进死信
 * 4. 永久失败 / 解析失败 / 未知异常 -> 直接进死信，不重试
 * 5. 无论走哪个分支，最后都会尝试 ack（受 Channel 健康检查保护）
 * 
 * 任何异常都在单条消息内处理完，不会抛给监听器容器
 */
@Slf4j
@Component
public class RetryingMessageConsumer {

    static final String ESCALATE_STEP = "escalate";
    static final String DEAD_LETTER_STEP = "dead-letter";

    private final OutcomeClassifier classifier;
    private final DeliveryMetadataCodec codec;
    private final BackoffPolicy backoffPolicy;
    private final RetryScheduler retryScheduler;
    private final DeadLetterSink deadLetterSink;
    private final ChannelHealthGuard guard;

    private final AtomicInteger messageCount = new AtomicInteger(0);

    public RetryingMessageConsumer(OutcomeClassifier classifier, DeliveryMetadataCodec codec,
                                   BackoffPolicy backoffPolicy, RetryScheduler retryScheduler,
                                   DeadLetterSink deadLetterSink, ChannelHealthGuard guard) {
        this.classifier = classifier;
        this.codec = codec;
        this.backoffPolicy = backoffPolicy;
        this.retryScheduler = retryScheduler;
        this.deadLetterSink = deadLetterSink;
        this.guard = guard;
    }

    /**
     * 守卫检查的是监听器通道，重试和死信通过 RabbitTemplate 的缓存通道发布，
     * 发布通道断开时由各步骤返回 FAILED，最终落到 REPORTED_LOSS
     */
    @RabbitListener(queues = "${rabbit-retry.consumer-queue:direct_logs.consumer}",
            containerFactory = "rabbitListenerContainerFactory")
    public void onMessage(Message message, Channel channel) {
        long deliveryTag = message.getMessageProperties().getDeliveryTag();
        try {
            handle(message, new ChannelSession(channel), () -> channel.basicAck(deliveryTag, false));
        } catch (RuntimeException e) {
            log.error("✗ [Consumer] 处理消息时出现未捕获异常, deliveryTag={}", deliveryTag, e);
        }
    }

    /**
     * 处理一条消息，返回最终处置
     */
    public Disposition handle(Message message, BrokerSession session, GuardedOperation ack) {
        int count = messageCount.incrementAndGet();
        MessageProperties properties = message.getMessageProperties();

        DeliveryMetadata metadata = null;
        Classification classification;
        try {
            metadata = codec.read(properties);
            log.info("← [Consumer] 收到消息 #{}: routingKey={}, RetryCount={}/{}",
                    count, properties.getReceivedRoutingKey(), metadata.getAttemptCount(),
                    backoffPolicy.getMaxRetryAttempts());
            classification = classifier.classify(message, metadata);
        } catch (RuntimeException e) {
            log.error("✗ [Consumer] 消息 #{} 出现未知异常: ", count, e);
            classification = Classification.unexpectedError(DeathReason.UNEXPECTED_ERROR_PREFIX + e, e);
        }

        String handledBy = dispatch(session, message, metadata, classification);

        GuardResult ackResult = guard.guarded(session, "ack", ack);
        if (ackResult.isOk()) {
            log.info("✓ [Consumer] 消息 #{} 已确认: {} -> {}", count, classification.getType(), handledBy);
        } else {
            log.warn("⚠ [Consumer] 消息 #{} 确认失败（{}），交由 Broker 重新投递: {} -> {}",
                    count, ackResult, classification.getType(), handledBy);
        }

        return new Disposition(classification.getType(), handledBy, ackResult);
    }

    private String dispatch(BrokerSession session, Message message, DeliveryMetadata metadata,
                            Classification classification) {
        switch (classification.getType()) {
            case SUCCESS:
                return Disposition.SUCCESS_STEP;

            case TRANSIENT_FAILURE:
                int attemptCount = metadata.getAttemptCount();
                if (backoffPolicy.hasRetryBudget(attemptCount)) {
                    return FallbackChain.start()
                            .then(ESCALATE_STEP, () -> retryScheduler.escalate(session, message, metadata)
                                    == EscalationResult.SCHEDULED)
                            .then(DEAD_LETTER_STEP, () -> deadLetter(session, message, metadata,
                                    String.format(DeathReason.RETRY_SCHEDULING_FAILED, attemptCount)))
                            .run();
                }
                log.error("☠ [Consumer] 消息达到最大重试次数: RetryCount={}/{}",
                        attemptCount, backoffPolicy.getMaxRetryAttempts());
                return FallbackChain.start()
                        .then(DEAD_LETTER_STEP, () -> deadLetter(session, message, metadata,
                                DeathReason.MAX_RETRY_EXCEEDED))
                        .run();

            default:
                return FallbackChain.start()
                        .then(DEAD_LETTER_STEP, () -> deadLetter(session, message, metadata,
                                classification.getReason()))
                        .run();
        }
    }

    private boolean deadLetter(BrokerSession session, Message message, DeliveryMetadata metadata, String reason) {
        return deadLetterSink.deadLetter(session, message, reason, metadata) == DeadLetterOutcome.DELIVERED;
    }
}

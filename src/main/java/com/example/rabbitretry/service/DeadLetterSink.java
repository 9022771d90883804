package com.example.rabbitretry.service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.ExecutionException;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.config.RetryProperties;
import com.example.rabbitretry.config.RetryTopology;
import com.example.rabbitretry.model.DeadLetterOutcome;
import com.example.rabbitretry.model.DeadLetterRecord;
import com.example.rabbitretry.model.DeliveryMetadata;
import com.example.rabbitretry.session.BrokerSession;
import com.example.rabbitretry.session.ChannelHealthGuard;
import com.example.rabbitretry.session.GuardResult;
import com.google.common.base.Strings;
import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;

import lombok.extern.slf4j.Slf4j;

/**
 * 死信投递
 * 
 * 重试耗尽或不可恢复的消息，附加死信原因、时间、原始路由键、重试次数后发布到死信队列
 * 
 * 尽力而为：发送失败时返回 LOST 并记录日志，从不抛出异常
 */
@Slf4j
@Component
public class DeadLetterSink {

    private final RabbitTemplate rabbitTemplate;
    private final AmqpAdmin amqpAdmin;
    private final RetryTopology topology;
    private final DeliveryMetadataCodec codec;
    private final ChannelHealthGuard guard;
    private final Clock clock;
    private final int reasonMaxLength;

    // 已绑定到死信队列的路由键
    private final Cache<String, Boolean> boundRoutingKeys = CacheBuilder.newBuilder().build();

    public DeadLetterSink(RabbitTemplate rabbitTemplate, AmqpAdmin amqpAdmin, RetryTopology topology,
                          DeliveryMetadataCodec codec, ChannelHealthGuard guard, Clock clock,
                          RetryProperties properties) {
        this.rabbitTemplate = rabbitTemplate;
        this.amqpAdmin = amqpAdmin;
        this.topology = topology;
        this.codec = codec;
        this.guard = guard;
        this.clock = clock;
        this.reasonMaxLength = properties.getDeathReasonMaxLength();
    }

    /**
     * @param metadata 投递元数据，元数据本身解析失败时为 null
     */
    public DeadLetterOutcome deadLetter(BrokerSession session, Message message, String reason,
                                        DeliveryMetadata metadata) {
        String routingKey = resolveRoutingKey(message, metadata);
        DeadLetterRecord record = buildRecord(reason, routingKey, metadata);

        GuardResult result = guard.guarded(session, "publish to " + topology.deadLetterQueue(), () -> {
            ensureBinding(routingKey);
            rabbitTemplate.send(topology.deadLetterExchange(), routingKey, toDeadLetterMessage(message, record));
        });

        if (result.isOk()) {
            log.error("☠ [Dead Letter Sink] 消息已发送到死信队列: routingKey={}, RetryCount={}, 原因: {}",
                    routingKey, record.retryCountOrZero(), abbreviate(record.getDeathReason()));
            return DeadLetterOutcome.DELIVERED;
        }

        log.error("✗ [Dead Letter Sink] 死信发送失败（{}），消息丢失: routingKey={}, 原因: {}",
                result, routingKey, record.getDeathReason());
        return DeadLetterOutcome.LOST;
    }

    DeadLetterRecord buildRecord(String reason, String routingKey, DeliveryMetadata metadata) {
        Instant now = clock.instant();
        return DeadLetterRecord.builder()
                .deathReason(truncate(Strings.nullToEmpty(reason)))
                .deathTimestamp(now.getEpochSecond())
                .deathDateTime(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(LocalDateTime.ofInstant(now, clock.getZone())))
                .originalRoutingKey(routingKey)
                .retryCountAtDeath(metadata != null ? metadata.getAttemptCount() : null)
                .build();
    }

    private String truncate(String reason) {
        return reason.length() > reasonMaxLength ? reason.substring(0, cutIndex(reason, reasonMaxLength)) : reason;
    }

    private static String abbreviate(String reason) {
        return reason.length() > 100 ? reason.substring(0, cutIndex(reason, 100)) + "..." : reason;
    }

    /**
     * 截断位置不能落在代理对中间，否则会留下半个字符
     */
    static int cutIndex(String text, int maxLength) {
        if (maxLength > 0 && Character.isHighSurrogate(text.charAt(maxLength - 1))
                && Character.isLowSurrogate(text.charAt(maxLength))) {
            return maxLength - 1;
        }
        return maxLength;
    }

    private static String resolveRoutingKey(Message message, DeliveryMetadata metadata) {
        if (metadata != null && metadata.getOriginalRoutingKey() != null) {
            return metadata.getOriginalRoutingKey();
        }
        return Strings.nullToEmpty(message.getMessageProperties().getReceivedRoutingKey());
    }

    /**
     * 死信交换机是 direct 类型，每个路由键需要单独绑定一次
     */
    private void ensureBinding(String routingKey) {
        try {
            boundRoutingKeys.get(routingKey, () -> {
                DirectExchange exchange = new DirectExchange(topology.deadLetterExchange(), true, false);
                Queue queue = QueueBuilder.durable(topology.deadLetterQueue()).build();
                amqpAdmin.declareExchange(exchange);
                amqpAdmin.declareQueue(queue);
                amqpAdmin.declareBinding(BindingBuilder.bind(queue).to(exchange).with(routingKey));
                return Boolean.TRUE;
            });
        } catch (ExecutionException | UncheckedExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new AmqpException(e.getCause());
        }
    }

    private Message toDeadLetterMessage(Message message, DeadLetterRecord record) {
        MessageProperties original = message.getMessageProperties();
        MessageProperties properties = new MessageProperties();
        properties.setContentType(original.getContentType());
        properties.setContentEncoding(original.getContentEncoding());
        properties.setMessageId(original.getMessageId());
        properties.setCorrelationId(original.getCorrelationId());
        properties.setReplyTo(original.getReplyTo());
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        codec.writeDeadLetter(record, properties);

        return MessageBuilder.withBody(message.getBody())
                .andProperties(properties)
                .build();
    }
}

package com.example.rabbitretry.publisher;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.config.RetryTopology;
import com.example.rabbitretry.model.LogMessage;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;

/**
 * 消息发布者
 * 把消息发布到业务交换机，消息持久化
 */
@Slf4j
@Component
public class MessagePublisher {

    private final RabbitTemplate rabbitTemplate;
    private final RetryTopology topology;

    public MessagePublisher(RabbitTemplate rabbitTemplate, RetryTopology topology) {
        this.rabbitTemplate = rabbitTemplate;
        this.topology = topology;
    }

    /**
     * 配置 Publisher Confirm 和 Return 回调
     */
    @PostConstruct
    public void init() {
        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            String id = correlationData != null ? correlationData.getId() : null;
            if (ack) {
                log.debug("✓ [Publisher Confirm] Broker 已确认: ID={}", id);
            } else {
                log.error("✗ [Publisher Confirm] 消息未到达 Exchange: ID={}, 原因: {}", id, cause);
            }
        });

        rabbitTemplate.setReturnsCallback(returned -> log.error("✗ [Publisher Return] 消息路由失败！" +
                        "\n  响应码: {}" +
                        "\n  响应信息: {}" +
                        "\n  交换机: {}" +
                        "\n  路由键: {}",
                returned.getReplyCode(),
                returned.getReplyText(),
                returned.getExchange(),
                returned.getRoutingKey()));

        log.info("Publisher Confirm 回调配置完成");
    }

    /**
     * 发送消息（带自动重试）
     * 临时网络问题自动重试3次，指数退避：1秒、2秒、4秒
     * 
     * @return 消息ID（成功时），null（重试耗尽时）
     */
    @Retryable(
        retryFor = AmqpException.class,
        maxAttempts = 4,
        backoff = @Backoff(
            delay = 1000,
            multiplier = 2.0,
            maxDelay = 10000
        )
    )
    public String send(String routingKey, String content) {
        String messageId = UUID.randomUUID().toString();
        CorrelationData correlationData = new CorrelationData(messageId);
        LogMessage message = LogMessage.of(routingKey, content);

        rabbitTemplate.convertAndSend(
                topology.originExchange(),
                routingKey,
                message,
                msg -> {
                    msg.getMessageProperties().setDeliveryMode(MessageDeliveryMode.PERSISTENT);
                    msg.getMessageProperties().setMessageId(messageId);
                    return msg;
                },
                correlationData
        );

        log.info("→ [Publisher] 消息已发送到 '{}': {}, ID: {}", routingKey, content, messageId);
        return messageId;
    }

    /**
     * 所有重试都失败后调用
     */
    @Recover
    public String recoverFromSendFailure(AmqpException e, String routingKey, String content) {
        log.error("✗ [Publisher] 消息发送失败（重试已用尽）: routingKey={}, content={}, 错误: {}",
                routingKey, content, e.getMessage());
        return null;
    }

    /**
     * 发送原始消息体（不做 JSON 转换），用于验证消息解析失败的处理
     */
    public String sendRaw(String routingKey, String body) {
        String messageId = UUID.randomUUID().toString();

        MessageProperties properties = new MessageProperties();
        properties.setContentType(MessageProperties.CONTENT_TYPE_JSON);
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        properties.setMessageId(messageId);
        Message message = MessageBuilder.withBody(body.getBytes(StandardCharsets.UTF_8))
                .andProperties(properties)
                .build();

        rabbitTemplate.send(topology.originExchange(), routingKey, message, new CorrelationData(messageId));

        log.info("→ [Publisher] 原始消息已发送到 '{}': {}, ID: {}", routingKey, body, messageId);
        return messageId;
    }
}

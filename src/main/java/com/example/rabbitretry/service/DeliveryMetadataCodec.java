package com.example.rabbitretry.service;

import java.util.Map;

import org.springframework.amqp.core.MessageProperties;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.constant.RetryConstants.Headers;
import com.example.rabbitretry.model.DeadLetterRecord;
import com.example.rabbitretry.model.DeliveryMetadata;

/**
 * 投递元数据编解码
 * 
 * 重试记账和死信信息都放在消息头里，
 * 写入时只使用 Integer / Long / String，读取时兼容 Broker 返回的各种整数类型
 */
@Component
public class DeliveryMetadataCodec {

    /**
     * 从消息头读取重试记账
     * 
     * @throws IllegalArgumentException 重试相关的头部不是合法整数
     */
    public DeliveryMetadata read(MessageProperties properties) {
        Map<String, Object> headers = properties.getHeaders();

        int attemptCount = 0;
        Integer retryCount = readInt(headers, Headers.RETRY_COUNT);
        if (retryCount != null) {
            if (retryCount < 0) {
                throw new IllegalArgumentException("Malformed " + Headers.RETRY_COUNT + " header: " + retryCount);
            }
            attemptCount = retryCount;
        }

        Object originalRoutingKey = headers.get(Headers.ORIGINAL_ROUTING_KEY);
        String routingKey = originalRoutingKey != null
                ? originalRoutingKey.toString()
                : properties.getReceivedRoutingKey();

        Integer delay = readInt(headers, Headers.RETRY_DELAY);
        if (retryCount == null && delay == null) {
            return DeliveryMetadata.initial(routingKey);
        }

        return new DeliveryMetadata(attemptCount, routingKey, delay);
    }

    /**
     * 把重试记账写入消息头
     */
    public void write(DeliveryMetadata metadata, MessageProperties properties) {
        properties.setHeader(Headers.RETRY_COUNT, metadata.getAttemptCount());
        if (metadata.getOriginalRoutingKey() != null) {
            properties.setHeader(Headers.ORIGINAL_ROUTING_KEY, metadata.getOriginalRoutingKey());
        }
        if (metadata.getComputedDelaySeconds() != null) {
            properties.setHeader(Headers.RETRY_DELAY, metadata.getComputedDelaySeconds());
        }
    }

    /**
     * 把死信记录写入消息头
     * x-retry-count 只在消息重试过时才写入
     */
    public void writeDeadLetter(DeadLetterRecord record, MessageProperties properties) {
        properties.setHeader(Headers.DEATH_REASON, record.getDeathReason());
        properties.setHeader(Headers.DEATH_TIMESTAMP, record.getDeathTimestamp());
        properties.setHeader(Headers.DEATH_DATETIME, record.getDeathDateTime());
        if (record.getOriginalRoutingKey() != null) {
            properties.setHeader(Headers.ORIGINAL_ROUTING_KEY, record.getOriginalRoutingKey());
        }
        if (record.getRetryCountAtDeath() != null && record.getRetryCountAtDeath() > 0) {
            properties.setHeader(Headers.RETRY_COUNT, record.getRetryCountAtDeath());
        }
    }

    /**
     * 从死信消息头读取死信记录，用于巡检，缺失或格式不对的字段留空
     */
    public DeadLetterRecord readDeadLetter(MessageProperties properties) {
        Map<String, Object> headers = properties.getHeaders();

        Object timestamp = headers.get(Headers.DEATH_TIMESTAMP);
        Integer retryCount;
        try {
            retryCount = readInt(headers, Headers.RETRY_COUNT);
        } catch (IllegalArgumentException e) {
            retryCount = null;
        }

        return DeadLetterRecord.builder()
                .deathReason(asString(headers.get(Headers.DEATH_REASON)))
                .deathTimestamp(timestamp instanceof Number ? ((Number) timestamp).longValue() : 0L)
                .deathDateTime(asString(headers.get(Headers.DEATH_DATETIME)))
                .originalRoutingKey(asString(headers.get(Headers.ORIGINAL_ROUTING_KEY)))
                .retryCountAtDeath(retryCount)
                .build();
    }

    private static Integer readInt(Map<String, Object> headers, String name) {
        Object value = headers.get(name);
        if (value == null) {
            return null;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            try {
                return Math.toIntExact(((Number) value).longValue());
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Malformed " + name + " header: " + value, e);
            }
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed " + name + " header: " + value, e);
            }
        }
        throw new IllegalArgumentException("Malformed " + name + " header: "
                + value + " (" + value.getClass().getSimpleName() + ")");
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}

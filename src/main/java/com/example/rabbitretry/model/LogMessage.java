package com.example.rabbitretry.model;

import java.time.LocalDateTime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 消息体
 * 重试时消息体原样转发，创建之后不再修改
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class LogMessage {

    String content;

    /**
     * 生产者写入的 ISO-8601 时间，按原样保留（可能带或不带时区偏移）
     */
    String timestamp;

    @JsonProperty("routing_key")
    String routingKey;

    public static LogMessage of(String routingKey, String content) {
        return LogMessage.builder()
                .content(content)
                .timestamp(LocalDateTime.now().toString())
                .routingKey(routingKey)
                .build();
    }
}

package com.example.rabbitretry.model;

import lombok.Builder;
import lombok.Value;

/**
 * 死信记录（随消息头发布，发布后不再修改）
 */
@Value
@Builder
public class DeadLetterRecord {

    /** 死信原因（已截断） */
    String deathReason;

    /** 进入死信的时间戳（秒） */
    long deathTimestamp;

    /** 进入死信的时间（ISO-8601） */
    String deathDateTime;

    String originalRoutingKey;

    /** 进入死信时的重试次数，从未重试过时为 null */
    Integer retryCountAtDeath;

    public int retryCountOrZero() {
        return retryCountAtDeath != null ? retryCountAtDeath : 0;
    }
}

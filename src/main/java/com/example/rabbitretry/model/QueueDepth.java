package com.example.rabbitretry.model;

import lombok.Value;

/**
 * 队列堆积数，队列不存在或查询失败时 messageCount 为 null
 */
@Value
public class QueueDepth {

    public static final String UNAVAILABLE = "N/A";

    String queueName;

    Long messageCount;

    public boolean isAvailable() {
        return messageCount != null;
    }

    public String display() {
        return messageCount != null ? String.valueOf(messageCount) : UNAVAILABLE;
    }
}

package com.example.rabbitretry.model;

import lombok.Value;

/**
 * 从死信队列取出的一条消息（用于巡检输出）
 */
@Value
public class DrainedDeadLetter {

    String content;

    DeadLetterRecord record;

    public String describe() {
        return String.format("Content: %s%n" +
                        "Original Routing Key: %s%n" +
                        "Death Reason: %s%n" +
                        "Death Time: %s (timestamp: %d)%n" +
                        "Retry Count: %d",
                content,
                orNa(record.getOriginalRoutingKey()),
                orNa(record.getDeathReason()),
                orNa(record.getDeathDateTime()),
                record.getDeathTimestamp(),
                record.retryCountOrZero());
    }

    private static String orNa(String value) {
        return value != null ? value : "N/A";
    }
}

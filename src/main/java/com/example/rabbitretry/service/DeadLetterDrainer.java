package com.example.rabbitretry.service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.config.RetryTopology;
import com.example.rabbitretry.model.DeadLetterRecord;
import com.example.rabbitretry.model.DrainedDeadLetter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * 死信队列取出
 * 逐条取出（取出即确认）并打印死信详情，供人工排查
 */
@Slf4j
@Component
public class DeadLetterDrainer {

    private static final String NOT_AVAILABLE = "N/A";

    private final RabbitTemplate rabbitTemplate;
    private final RetryTopology topology;
    private final DeliveryMetadataCodec codec;
    private final ObjectMapper objectMapper;

    public DeadLetterDrainer(RabbitTemplate rabbitTemplate, RetryTopology topology,
                             DeliveryMetadataCodec codec, ObjectMapper objectMapper) {
        this.rabbitTemplate = rabbitTemplate;
        this.topology = topology;
        this.codec = codec;
        this.objectMapper = objectMapper;
    }

    /**
     * 最多取出 limit 条死信
     */
    public List<DrainedDeadLetter> drain(int limit) {
        List<DrainedDeadLetter> drained = new ArrayList<>();
        while (drained.size() < limit) {
            Message message = rabbitTemplate.receive(topology.deadLetterQueue());
            if (message == null) {
                break;
            }

            DeadLetterRecord record = codec.readDeadLetter(message.getMessageProperties());
            DrainedDeadLetter deadLetter = new DrainedDeadLetter(extractContent(message), record);
            log.info("\n=== Dead Letter Message ===\n{}\n==============================", deadLetter.describe());
            drained.add(deadLetter);
        }

        if (drained.isEmpty()) {
            log.info("No messages in dead letter queue.");
        } else {
            log.info("✓ [DLQ Drainer] 已取出 {} 条死信", drained.size());
        }
        return drained;
    }

    private String extractContent(Message message) {
        try {
            JsonNode node = objectMapper.readTree(message.getBody());
            JsonNode content = node != null ? node.get("content") : null;
            return content != null && !content.isNull() ? content.asText() : NOT_AVAILABLE;
        } catch (IOException e) {
            log.warn("⚠ [DLQ Drainer] 死信消息体不是合法 JSON: {}", e.getMessage());
            return NOT_AVAILABLE;
        }
    }
}

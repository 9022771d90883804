package com.example.rabbitretry.service;

import java.io.IOException;

import org.springframework.amqp.core.Message;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.constant.RetryConstants.DeathReason;
import com.example.rabbitretry.exception.PermanentFailureException;
import com.example.rabbitretry.model.Classification;
import com.example.rabbitretry.model.DeliveryMetadata;
import com.example.rabbitretry.model.LogMessage;
import com.example.rabbitretry.model.ProcessingOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * 消费结果分类
 * 
 * 1. 消息体无法解析 -> PARSE_ERROR
 * 2. 业务返回 SUCCESS / TRANSIENT_FAILURE -> 原样返回
 * 3. 业务抛出 PermanentFailureException -> PERMANENT_FAILURE
 * 4. 业务抛出其他异常 -> UNEXPECTED_ERROR（不重试，避免把 bug 当成临时错误反复重试）
 */
@Slf4j
@Component
public class OutcomeClassifier {

    private final ObjectMapper objectMapper;
    private final MessageHandler messageHandler;

    public OutcomeClassifier(ObjectMapper objectMapper, MessageHandler messageHandler) {
        this.objectMapper = objectMapper;
        this.messageHandler = messageHandler;
    }

    public Classification classify(Message message, DeliveryMetadata metadata) {
        LogMessage payload;
        try {
            payload = objectMapper.readValue(message.getBody(), LogMessage.class);
        } catch (IOException e) {
            String detail = e instanceof JsonProcessingException
                    ? ((JsonProcessingException) e).getOriginalMessage()
                    : e.getMessage();
            log.error("✗ [Classifier] 消息体不是合法 JSON: {}", detail);
            return Classification.parseError(DeathReason.INVALID_JSON_PREFIX + detail, e);
        }

        if (payload == null || payload.getContent() == null) {
            log.error("✗ [Classifier] 消息体缺少 content 字段");
            return Classification.parseError(
                    DeathReason.INVALID_JSON_PREFIX + "missing required field 'content'", null);
        }

        log.info("→ [Classifier] 处理消息: content={}, timestamp={}", payload.getContent(), payload.getTimestamp());

        try {
            ProcessingOutcome outcome = messageHandler.handle(payload, metadata);
            if (outcome == ProcessingOutcome.SUCCESS) {
                return Classification.success();
            }
            if (outcome == ProcessingOutcome.TRANSIENT_FAILURE) {
                return Classification.transientFailure();
            }
            return Classification.unexpectedError(
                    DeathReason.UNEXPECTED_ERROR_PREFIX + "handler returned no outcome", null);
        } catch (PermanentFailureException e) {
            log.error("✗ [Classifier] 永久失败: {}", e.getMessage());
            return Classification.permanentFailure(String.valueOf(e.getMessage()), e);
        } catch (RuntimeException e) {
            log.error("✗ [Classifier] 未知异常: ", e);
            return Classification.unexpectedError(DeathReason.UNEXPECTED_ERROR_PREFIX + e, e);
        }
    }
}

package com.example.rabbitretry.service;

import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.exception.PermanentFailureException;
import com.example.rabbitretry.model.DeliveryMetadata;
import com.example.rabbitretry.model.LogMessage;
import com.example.rabbitretry.model.ProcessingOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * 演示用业务处理
 * 根据消息内容模拟不同的失败类型：
 * - critical_error：永久失败
 * - temporary_error：临时失败
 * - random_fail：50% 概率临时失败
 */
@Slf4j
@Component
public class DemoMessageHandler implements MessageHandler {

    static final String CRITICAL_ERROR = "critical_error";
    static final String TEMPORARY_ERROR = "temporary_error";
    static final String RANDOM_FAIL = "random_fail";

    private final DoubleSupplier random;

    @Autowired
    public DemoMessageHandler() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    DemoMessageHandler(DoubleSupplier random) {
        this.random = random;
    }

    @Override
    public ProcessingOutcome handle(LogMessage message, DeliveryMetadata metadata) {
        String content = message.getContent().toLowerCase(Locale.ROOT);

        if (content.contains(CRITICAL_ERROR)) {
            throw new PermanentFailureException("Critical error - should not retry");
        }

        if (content.contains(TEMPORARY_ERROR)) {
            log.warn("⚠ [Handler] 临时错误: Temporary connection issue");
            return ProcessingOutcome.TRANSIENT_FAILURE;
        }

        if (content.contains(RANDOM_FAIL) && random.getAsDouble() < 0.5) {
            log.warn("⚠ [Handler] 临时错误: Random processing error");
            return ProcessingOutcome.TRANSIENT_FAILURE;
        }

        log.info("✓ [Handler] 业务处理完成: {}", message.getContent());
        return ProcessingOutcome.SUCCESS;
    }
}

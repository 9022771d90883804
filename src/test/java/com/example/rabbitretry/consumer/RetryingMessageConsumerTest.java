package com.example.rabbitretry.consumer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import com.example.rabbitretry.config.RetryProperties;
import com.example.rabbitretry.config.RetryTopology;
import com.example.rabbitretry.constant.RetryConstants.Headers;
import com.example.rabbitretry.model.ClassificationType;
import com.example.rabbitretry.model.Disposition;
import com.example.rabbitretry.service.BackoffPolicy;
import com.example.rabbitretry.service.DeadLetterSink;
import com.example.rabbitretry.service.DeliveryMetadataCodec;
import com.example.rabbitretry.service.DemoMessageHandler;
import com.example.rabbitretry.service.FallbackChain;
import com.example.rabbitretry.service.HoldingQueueRedelivery;
import com.example.rabbitretry.service.MessageHandler;
import com.example.rabbitretry.service.OutcomeClassifier;
import com.example.rabbitretry.service.RetryScheduler;
import com.example.rabbitretry.session.BrokerSession;
import com.example.rabbitretry.session.ChannelHealthGuard;
import com.example.rabbitretry.session.GuardResult;
import com.example.rabbitretry.session.GuardedOperation;
import com.example.rabbitretry.session.SessionState;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * RetryingMessageConsumer 单元测试
 *
 * 除 RabbitTemplate / AmqpAdmin 外都使用真实组件，
 * 延迟队列到期后的重投由测试把发出的消息再喂回消费者来模拟
 */
@ExtendWith(MockitoExtension.class)
class RetryingMessageConsumerTest {

    private static final BrokerSession OPEN = () -> SessionState.OPEN;
    private static final BrokerSession CLOSED = () -> SessionState.CLOSED;

    private static final String RETRY_EXCHANGE = "direct_logs_retry";
    private static final String DLQ_EXCHANGE = "direct_logs_dlq";

    @Mock
    private AmqpAdmin amqpAdmin;

    @Mock
    private RabbitTemplate rabbitTemplate;

    private ObjectMapper objectMapper;
    private AtomicInteger acks;
    private GuardedOperation ack;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        acks = new AtomicInteger();
        ack = acks::incrementAndGet;
    }

    @Test
    void testHandle_Success() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());

        // When
        Disposition disposition = consumer.handle(json("info", "hello world"), OPEN, ack);

        // Then
        assertEquals(ClassificationType.SUCCESS, disposition.getClassification());
        assertEquals(Disposition.SUCCESS_STEP, disposition.getHandledBy());
        assertEquals(GuardResult.OK, disposition.getAckResult());
        assertEquals(1, acks.get());
        verifyNoInteractions(rabbitTemplate);
    }

    @Test
    void testHandle_TransientFailureEscalatesThenDeadLetters() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());
        Message inbound = json("warning", "temporary_error - should retry");
        List<Object> delays = new ArrayList<>();

        // When
        for (int attempt = 0; attempt < 3; attempt++) {
            Disposition disposition = consumer.handle(inbound, OPEN, ack);

            assertEquals(ClassificationType.TRANSIENT_FAILURE, disposition.getClassification());
            assertEquals(RetryingMessageConsumer.ESCALATE_STEP, disposition.getHandledBy());

            ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
            verify(rabbitTemplate, times(attempt + 1)).send(eq(RETRY_EXCHANGE), eq("warning"), captor.capture());
            Message retried = captor.getValue();
            assertEquals(attempt + 1, retried.getMessageProperties().getHeaders().get(Headers.RETRY_COUNT));
            delays.add(retried.getMessageProperties().getHeaders().get(Headers.RETRY_DELAY));

            inbound = expire(retried, "warning");
        }
        Disposition last = consumer.handle(inbound, OPEN, ack);

        // Then
        assertEquals(List.of(1, 2, 4), delays);
        assertEquals(RetryingMessageConsumer.DEAD_LETTER_STEP, last.getHandledBy());
        assertEquals(4, acks.get());

        ArgumentCaptor<Message> dlqCaptor = ArgumentCaptor.forClass(Message.class);
        verify(rabbitTemplate).send(eq(DLQ_EXCHANGE), eq("warning"), dlqCaptor.capture());
        Map<String, Object> headers = dlqCaptor.getValue().getMessageProperties().getHeaders();
        assertEquals("Max retry attempts exceeded", headers.get(Headers.DEATH_REASON));
        assertEquals(3, headers.get(Headers.RETRY_COUNT));
        assertEquals("warning", headers.get(Headers.ORIGINAL_ROUTING_KEY));

        ArgumentCaptor<Queue> queueCaptor = ArgumentCaptor.forClass(Queue.class);
        verify(amqpAdmin, times(4)).declareQueue(queueCaptor.capture());
        assertEquals(List.of("retry_queue_1s", "retry_queue_2s", "retry_queue_4s", "dead_letter_queue"),
                queueCaptor.getAllValues().stream().map(Queue::getName).collect(Collectors.toList()));
    }

    @Test
    void testHandle_PermanentFailureSkipsRetry() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());

        // When
        Disposition disposition = consumer.handle(json("error", "critical_error - permanent failure"), OPEN, ack);

        // Then
        assertEquals(ClassificationType.PERMANENT_FAILURE, disposition.getClassification());
        assertEquals(RetryingMessageConsumer.DEAD_LETTER_STEP, disposition.getHandledBy());
        assertEquals(1, acks.get());

        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(rabbitTemplate).send(eq(DLQ_EXCHANGE), eq("error"), captor.capture());
        Map<String, Object> headers = captor.getValue().getMessageProperties().getHeaders();
        assertEquals("Critical error - should not retry", headers.get(Headers.DEATH_REASON));
        assertFalse(headers.containsKey(Headers.RETRY_COUNT));

        verify(rabbitTemplate, never()).send(eq(RETRY_EXCHANGE), anyString(), any(Message.class));
        verify(amqpAdmin, never()).declareQueue(argThat(queue -> queue.getName().startsWith("retry_queue_")));
    }

    @Test
    void testHandle_PermanentFailureAfterRetries() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());
        Message inbound = json("error", "critical_error");
        inbound.getMessageProperties().setHeader(Headers.RETRY_COUNT, 2);
        inbound.getMessageProperties().setHeader(Headers.ORIGINAL_ROUTING_KEY, "error");

        // When
        consumer.handle(inbound, OPEN, ack);

        // Then
        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(rabbitTemplate).send(eq(DLQ_EXCHANGE), eq("error"), captor.capture());
        assertEquals(2, captor.getValue().getMessageProperties().getHeaders().get(Headers.RETRY_COUNT));
    }

    @Test
    void testHandle_InvalidJson() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());
        Message inbound = MessageBuilder.withBody("invalid json {broken".getBytes(StandardCharsets.UTF_8))
                .setReceivedRoutingKey("error")
                .build();

        // When
        Disposition disposition = consumer.handle(inbound, OPEN, ack);

        // Then
        assertEquals(ClassificationType.PARSE_ERROR, disposition.getClassification());
        assertEquals(1, acks.get());

        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(rabbitTemplate).send(eq(DLQ_EXCHANGE), eq("error"), captor.capture());
        Map<String, Object> headers = captor.getValue().getMessageProperties().getHeaders();
        assertTrue(((String) headers.get(Headers.DEATH_REASON)).startsWith("Invalid JSON:"));
        assertFalse(headers.containsKey(Headers.RETRY_COUNT));
    }

    @Test
    void testHandle_HandlerBug() {
        // Given
        RetryingMessageConsumer consumer = newConsumer((message, metadata) -> {
            throw new NullPointerException("customer id");
        });

        // When
        Disposition disposition = consumer.handle(json("info", "hello"), OPEN, ack);

        // Then
        assertEquals(ClassificationType.UNEXPECTED_ERROR, disposition.getClassification());
        assertEquals(RetryingMessageConsumer.DEAD_LETTER_STEP, disposition.getHandledBy());
        verify(rabbitTemplate, never()).send(eq(RETRY_EXCHANGE), anyString(), any(Message.class));
    }

    @Test
    void testHandle_MalformedRetryHeader() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());
        Message inbound = json("info", "hello");
        inbound.getMessageProperties().setHeader(Headers.RETRY_COUNT, "three");

        // When
        Disposition disposition = consumer.handle(inbound, OPEN, ack);

        // Then
        assertEquals(ClassificationType.UNEXPECTED_ERROR, disposition.getClassification());
        assertEquals(1, acks.get());

        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(rabbitTemplate).send(eq(DLQ_EXCHANGE), eq("info"), captor.capture());
        Map<String, Object> headers = captor.getValue().getMessageProperties().getHeaders();
        assertTrue(((String) headers.get(Headers.DEATH_REASON)).startsWith("Unexpected error: "));
        assertFalse(headers.containsKey(Headers.RETRY_COUNT));
    }

    @Test
    void testHandle_RetryPublishFailsFallsBackToDeadLetter() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());
        lenient().doThrow(new AmqpException("connection reset"))
                .when(rabbitTemplate).send(eq(RETRY_EXCHANGE), anyString(), any(Message.class));

        // When
        Disposition disposition = consumer.handle(json("warning", "temporary_error"), OPEN, ack);

        // Then
        assertEquals(RetryingMessageConsumer.DEAD_LETTER_STEP, disposition.getHandledBy());
        assertEquals(GuardResult.OK, disposition.getAckResult());

        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(rabbitTemplate).send(eq(DLQ_EXCHANGE), eq("warning"), captor.capture());
        assertEquals("Retry scheduling failed after 0 attempts",
                captor.getValue().getMessageProperties().getHeaders().get(Headers.DEATH_REASON));
    }

    @Test
    void testHandle_PublishingConnectionDownWhileListenerChannelOpen() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());
        doThrow(new AmqpException("connection refused"))
                .when(rabbitTemplate).send(anyString(), anyString(), any(Message.class));

        // When
        Disposition disposition = consumer.handle(json("warning", "temporary_error"), OPEN, ack);

        // Then
        assertEquals(FallbackChain.REPORTED_LOSS, disposition.getHandledBy());
        assertEquals(GuardResult.OK, disposition.getAckResult());
        assertEquals(1, acks.get());
        verify(rabbitTemplate).send(eq(RETRY_EXCHANGE), eq("warning"), any(Message.class));
        verify(rabbitTemplate).send(eq(DLQ_EXCHANGE), eq("warning"), any(Message.class));
    }

    @Test
    void testHandle_ChannelDown() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());

        // When
        Disposition disposition = consumer.handle(json("warning", "temporary_error"), CLOSED, ack);

        // Then
        assertEquals(ClassificationType.TRANSIENT_FAILURE, disposition.getClassification());
        assertEquals(FallbackChain.REPORTED_LOSS, disposition.getHandledBy());
        assertTrue(disposition.isReportedLoss());
        assertEquals(GuardResult.SKIPPED, disposition.getAckResult());
        assertEquals(0, acks.get());
        verifyNoInteractions(rabbitTemplate, amqpAdmin);
    }

    @Test
    void testHandle_AckFails() {
        // Given
        RetryingMessageConsumer consumer = newConsumer(new DemoMessageHandler());

        // When
        Disposition disposition = consumer.handle(json("info", "hello"), OPEN, () -> {
            throw new IOException("channel closed");
        });

        // Then
        assertEquals(ClassificationType.SUCCESS, disposition.getClassification());
        assertEquals(GuardResult.FAILED, disposition.getAckResult());
    }

    private RetryingMessageConsumer newConsumer(MessageHandler handler) {
        RetryProperties properties = new RetryProperties();
        RetryTopology topology = new RetryTopology(properties);
        DeliveryMetadataCodec codec = new DeliveryMetadataCodec();
        ChannelHealthGuard guard = new ChannelHealthGuard();
        BackoffPolicy backoffPolicy = new BackoffPolicy(properties);

        HoldingQueueRedelivery redelivery = new HoldingQueueRedelivery(amqpAdmin, rabbitTemplate, topology, codec, guard);
        RetryScheduler retryScheduler = new RetryScheduler(backoffPolicy, redelivery);
        DeadLetterSink deadLetterSink = new DeadLetterSink(rabbitTemplate, amqpAdmin, topology, codec, guard,
                Clock.fixed(Instant.parse("2025-06-01T10:00:00Z"), ZoneOffset.UTC), properties);
        OutcomeClassifier classifier = new OutcomeClassifier(objectMapper, handler);

        return new RetryingMessageConsumer(classifier, codec, backoffPolicy, retryScheduler, deadLetterSink, guard);
    }

    private static Message json(String routingKey, String content) {
        String body = "{\"content\":\"" + content + "\",\"timestamp\":\"2025-06-01T10:00:00.123456\","
                + "\"routing_key\":\"" + routingKey + "\"}";
        return MessageBuilder.withBody(body.getBytes(StandardCharsets.UTF_8))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setReceivedExchange("direct_logs")
                .setReceivedRoutingKey(routingKey)
                .build();
    }

    /**
     * 模拟延迟队列到期：Broker 把消息按原路由键死信回业务交换机
     */
    private static Message expire(Message retried, String routingKey) {
        MessageProperties properties = new MessageProperties();
        properties.getHeaders().putAll(retried.getMessageProperties().getHeaders());
        properties.setHeader("x-death", List.of(Map.of("reason", "expired", "count", 1L)));
        properties.setContentType(retried.getMessageProperties().getContentType());
        properties.setReceivedExchange("direct_logs");
        properties.setReceivedRoutingKey(routingKey);
        return MessageBuilder.withBody(retried.getBody()).andProperties(properties).build();
    }
}

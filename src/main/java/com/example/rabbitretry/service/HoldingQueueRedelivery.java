package com.example.rabbitretry.service;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.HeadersExchange;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageDeliveryMode;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.config.RetryTopology;
import com.example.rabbitretry.constant.RetryConstants.Headers;
import com.example.rabbitretry.model.DeliveryMetadata;
import com.example.rabbitretry.model.EscalationResult;
import com.example.rabbitretry.session.BrokerSession;
import com.example.rabbitretry.session.ChannelHealthGuard;
import com.example.rabbitretry.session.GuardResult;
import com.google.common.base.Throwables;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;

import lombok.extern.slf4j.Slf4j;

/**
 * 基于 TTL + 死信交换机的延迟重投
 * 
 * 工作原理：
 * 1. 每个延迟值对应一个延迟队列 retry_queue_Ns，没有消费者
 * 2. 队列配置 x-message-ttl = N * 1000，x-dead-letter-exchange = 业务交换机
 * 3. 消息过期后被 Broker 死信回业务交换机，路由键沿用发布时的原始路由键
 * 4. 延迟队列按 retry-holding-delay 头绑定到重试交换机（Headers 类型），一条消息只进一个延迟队列
 * 
 * 延迟队列在第一次用到时声明，之后复用，本服务不会删除
 */
@Slf4j
@Component
public class HoldingQueueRedelivery implements DelayedRedelivery {

    private final AmqpAdmin amqpAdmin;
    private final RabbitTemplate rabbitTemplate;
    private final RetryTopology topology;
    private final DeliveryMetadataCodec codec;
    private final ChannelHealthGuard guard;

    // 已声明的延迟队列（key = 延迟秒数），只用来省掉重复的声明请求
    private final Cache<Long, Queue> declaredQueues = CacheBuilder.newBuilder().build();

    public HoldingQueueRedelivery(AmqpAdmin amqpAdmin, RabbitTemplate rabbitTemplate, RetryTopology topology,
                                  DeliveryMetadataCodec codec, ChannelHealthGuard guard) {
        this.amqpAdmin = amqpAdmin;
        this.rabbitTemplate = rabbitTemplate;
        this.topology = topology;
        this.codec = codec;
        this.guard = guard;
    }

    @Override
    public EscalationResult scheduleRedelivery(BrokerSession session, Message message,
                                               DeliveryMetadata metadata, Duration delay) {
        long delaySeconds = delay.getSeconds();
        String queueName = topology.holdingQueueName(delaySeconds);

        GuardResult result = guard.guarded(session, "publish to " + queueName, () -> {
            holdingQueue(delaySeconds);
            rabbitTemplate.send(topology.retryExchange(), metadata.getOriginalRoutingKey(),
                    toRetryMessage(message, metadata, delaySeconds));
        });

        if (result.isOk()) {
            log.info("→ [Retry Scheduler] 消息已发送到延迟队列: queue={}, RetryCount={}, Delay={}s",
                    queueName, metadata.getAttemptCount(), delaySeconds);
            return EscalationResult.SCHEDULED;
        }

        log.error("✗ [Retry Scheduler] 发送到延迟队列失败: queue={}, guard={}", queueName, result);
        return EscalationResult.ABANDONED;
    }

    @Override
    public Collection<String> knownDelayQueues() {
        TreeSet<String> names = new TreeSet<>();
        declaredQueues.asMap().values().forEach(queue -> names.add(queue.getName()));
        return names;
    }

    /**
     * 取得（必要时声明）延迟队列
     */
    Queue holdingQueue(long delaySeconds) {
        try {
            return declaredQueues.get(delaySeconds, () -> declareHoldingQueue(delaySeconds));
        } catch (ExecutionException | UncheckedExecutionException e) {
            Throwables.throwIfUnchecked(e.getCause());
            throw new AmqpException(e.getCause());
        }
    }

    private Queue declareHoldingQueue(long delaySeconds) {
        String queueName = topology.holdingQueueName(delaySeconds);
        int ttlMillis = Math.toIntExact(Math.multiplyExact(delaySeconds, 1000L));

        Queue queue = QueueBuilder.durable(queueName)
                .ttl(ttlMillis)
                .deadLetterExchange(topology.originExchange())
                .build();
        HeadersExchange retryExchange = new HeadersExchange(topology.retryExchange(), true, false);

        // 声明是幂等的：队列已存在且参数一致时不会有任何副作用
        amqpAdmin.declareExchange(retryExchange);
        amqpAdmin.declareQueue(queue);
        amqpAdmin.declareBinding(BindingBuilder.bind(queue)
                .to(retryExchange)
                .whereAll(Map.of(Headers.HOLDING_DELAY, (Object) Math.toIntExact(delaySeconds)))
                .match());

        log.info("✓ [Retry Scheduler] 延迟队列已声明: queue={}, ttl={}ms, dlx={}",
                queueName, ttlMillis, topology.originExchange());
        return queue;
    }

    /**
     * 消息体原样转发，消息头只保留重试记账和路由头
     */
    private Message toRetryMessage(Message message, DeliveryMetadata metadata, long delaySeconds) {
        MessageProperties original = message.getMessageProperties();
        MessageProperties properties = new MessageProperties();
        properties.setContentType(original.getContentType());
        properties.setContentEncoding(original.getContentEncoding());
        properties.setMessageId(original.getMessageId());
        properties.setCorrelationId(original.getCorrelationId());
        properties.setReplyTo(original.getReplyTo());
        properties.setDeliveryMode(MessageDeliveryMode.PERSISTENT);
        codec.write(metadata, properties);
        properties.setHeader(Headers.HOLDING_DELAY, Math.toIntExact(delaySeconds));

        return MessageBuilder.withBody(message.getBody())
                .andProperties(properties)
                .build();
    }
}

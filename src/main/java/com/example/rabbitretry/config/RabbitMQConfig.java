package com.example.rabbitretry.config;

import java.util.List;
import java.util.stream.Collectors;

import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.Declarables;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.HeadersExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * RabbitMQ 配置类
 * 统一定义启动时就确定的队列、交换机、绑定关系
 * 包括：业务交换机、消费队列、重试交换机、死信交换机和死信队列
 * 
 * 延迟队列（retry_queue_Ns）不在这里声明，由 HoldingQueueRedelivery 按需创建
 */
@Configuration
public class RabbitMQConfig {

    // ========== 业务交换机和消费队列 ==========

    /**
     * 业务直连交换机
     * 延迟队列中的消息过期后会死信回到这里
     */
    @Bean
    public DirectExchange originExchange(RetryTopology topology) {
        return ExchangeBuilder.directExchange(topology.originExchange())
                .durable(true)
                .build();
    }

    /**
     * 消费队列
     */
    @Bean
    public Queue consumerQueue(RetryTopology topology) {
        return QueueBuilder.durable(topology.consumerQueue())
                .build();
    }

    /**
     * 按配置的路由键把消费队列绑定到业务交换机
     */
    @Bean
    public Declarables consumerBindings(Queue consumerQueue, DirectExchange originExchange,
                                        RetryProperties properties) {
        List<Binding> bindings = properties.getRoutingKeys().stream()
                .map(routingKey -> BindingBuilder.bind(consumerQueue).to(originExchange).with(routingKey))
                .collect(Collectors.toList());
        return new Declarables(bindings);
    }

    // ========== 重试交换机 ==========

    /**
     * 重试交换机（Headers 类型）
     * 
     * 每个延迟队列按 retry-holding-delay 头绑定（x-match=all），
     * 消息用原始路由键发布，只会进入与其延迟匹配的那一个延迟队列
     */
    @Bean
    public HeadersExchange retryExchange(RetryTopology topology) {
        return ExchangeBuilder.headersExchange(topology.retryExchange())
                .durable(true)
                .build();
    }

    // ========== 死信交换机和死信队列 ==========

    /**
     * 死信交换机
     */
    @Bean
    public DirectExchange deadLetterExchange(RetryTopology topology) {
        return ExchangeBuilder.directExchange(topology.deadLetterExchange())
                .durable(true)
                .build();
    }

    /**
     * 死信队列
     */
    @Bean
    public Queue deadLetterQueue(RetryTopology topology) {
        return QueueBuilder.durable(topology.deadLetterQueue())
                .build();
    }

    /**
     * 已知路由键的死信绑定
     * 其他路由键由 DeadLetterSink 在第一次使用时补充绑定
     */
    @Bean
    public Declarables deadLetterBindings(Queue deadLetterQueue, DirectExchange deadLetterExchange,
                                          RetryProperties properties) {
        List<Binding> bindings = properties.getRoutingKeys().stream()
                .map(routingKey -> BindingBuilder.bind(deadLetterQueue).to(deadLetterExchange).with(routingKey))
                .collect(Collectors.toList());
        return new Declarables(bindings);
    }

    // ========== 其他配置 ==========

    /**
     * 配置消息转换器（JSON格式）
     * 使用 Spring Boot 的 ObjectMapper，时间戳按原样的 ISO-8601 字符串收发
     */
    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    /**
     * 配置 RabbitTemplate
     * 用于发送消息，并配置 Publisher Confirm 回调
     */
    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory,
                                         MessageConverter messageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);

        // 设置消息转换器
        rabbitTemplate.setMessageConverter(messageConverter);

        // 设置为 true，当消息无法路由到队列时，会触发 ReturnCallback
        rabbitTemplate.setMandatory(true);

        return rabbitTemplate;
    }
}

package com.example.rabbitretry.config;

import org.springframework.amqp.core.AcknowledgeMode;
import org.springframework.amqp.rabbit.config.SimpleRabbitListenerContainerFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.listener.RabbitListenerContainerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.amqp.SimpleRabbitListenerContainerFactoryConfigurer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 连接和消费者配置
 */
@Configuration
public class RabbitMQConnectionConfig {

    @Value("${spring.rabbitmq.listener.simple.prefetch:1}")
    private int prefetchCount;

    /**
     * 配置连接工厂
     */
    @Bean
    public CachingConnectionFactory connectionFactory(RabbitProperties properties) {

        CachingConnectionFactory factory = new CachingConnectionFactory();

        // 基本连接配置
        factory.setHost(properties.getHost());
        factory.setPort(properties.getPort());
        factory.setUsername(properties.getUsername());
        factory.setPassword(properties.getPassword());
        factory.setVirtualHost(properties.getVirtualHost());

        // Publisher 配置：MessagePublisher 按 CorrelationData 关联确认，mandatory 退回由 RabbitTemplate 记录
        factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.CORRELATED);
        factory.setPublisherReturns(true);

        // 连接恢复配置：断线后监听器和延迟队列声明都依赖自动恢复
        factory.getRabbitConnectionFactory().setAutomaticRecoveryEnabled(true);
        factory.getRabbitConnectionFactory().setNetworkRecoveryInterval(5000);

        // 连接超时配置
        factory.getRabbitConnectionFactory().setConnectionTimeout(15000);
        factory.getRabbitConnectionFactory().setHandshakeTimeout(10000);

        return factory;
    }

    /**
     * 重试消费者的监听器容器工厂
     * 
     * 单线程、prefetch=1：一条消息分类、转发、确认完成后才接收下一条。
     * 需要并行时部署多个消费实例，而不是调大这里的并发数
     */
    @Bean
    public RabbitListenerContainerFactory<?> rabbitListenerContainerFactory(
            ConnectionFactory connectionFactory,
            SimpleRabbitListenerContainerFactoryConfigurer configurer) {

        SimpleRabbitListenerContainerFactory factory = new SimpleRabbitListenerContainerFactory();

        // 应用默认配置
        configurer.configure(factory, connectionFactory);

        factory.setAcknowledgeMode(AcknowledgeMode.MANUAL);
        factory.setPrefetchCount(prefetchCount);
        factory.setConcurrentConsumers(1);
        factory.setMaxConcurrentConsumers(1);

        // 失败的消息不重新入队
        factory.setDefaultRequeueRejected(false);

        return factory;
    }
}

package com.example.rabbitretry.service;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

import org.springframework.amqp.core.Message;

import com.example.rabbitretry.model.DeliveryMetadata;
import com.example.rabbitretry.model.EscalationResult;
import com.example.rabbitretry.session.BrokerSession;

/**
 * 延迟重投
 * 只负责"在 delay 之后把消息送回业务交换机"，不关心延迟是怎么算出来的
 */
public interface DelayedRedelivery {

    /**
     * @param message  收到的原始消息，消息体原样转发
     * @param metadata 更新后的投递元数据（次数已 +1）
     * @param delay    延迟时间
     */
    EscalationResult scheduleRedelivery(BrokerSession session, Message message,
                                        DeliveryMetadata metadata, Duration delay);

    /**
     * 本进程已经用过的延迟队列名
     */
    default Collection<String> knownDelayQueues() {
        return List.of();
    }
}

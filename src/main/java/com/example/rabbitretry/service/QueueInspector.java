package com.example.rabbitretry.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.AmqpAdmin;
import org.springframework.amqp.core.QueueInformation;
import org.springframework.stereotype.Component;

import com.example.rabbitretry.config.RetryTopology;
import com.example.rabbitretry.model.QueueDepth;
import com.google.common.base.Strings;

import lombok.extern.slf4j.Slf4j;

/**
 * 队列巡检（只读）
 * 查看死信队列和各延迟队列的消息堆积数，单个队列不存在不影响整体报告
 */
@Slf4j
@Component
public class QueueInspector {

    private final AmqpAdmin amqpAdmin;
    private final RetryTopology topology;
    private final BackoffPolicy backoffPolicy;
    private final DelayedRedelivery redelivery;

    public QueueInspector(AmqpAdmin amqpAdmin, RetryTopology topology,
                          BackoffPolicy backoffPolicy, DelayedRedelivery redelivery) {
        this.amqpAdmin = amqpAdmin;
        this.topology = topology;
        this.backoffPolicy = backoffPolicy;
        this.redelivery = redelivery;
    }

    /**
     * 队列当前消息数，队列不存在或查询失败时为空
     */
    public OptionalLong depth(String queueName) {
        try {
            QueueInformation info = amqpAdmin.getQueueInfo(queueName);
            if (info == null) {
                log.debug("Queue {} not found", queueName);
                return OptionalLong.empty();
            }
            return OptionalLong.of(info.getMessageCount());
        } catch (AmqpException e) {
            log.warn("⚠ [Queue Inspector] 查询队列失败: {}, 原因: {}", queueName, e.getMessage());
            return OptionalLong.empty();
        }
    }

    /**
     * 需要巡检的队列：死信队列 + 按退避策略推算的延迟队列 + 本进程已声明过的延迟队列
     */
    public List<String> knownQueueNames() {
        Set<String> names = new LinkedHashSet<>();
        names.add(topology.deadLetterQueue());
        backoffPolicy.plannedDelays().forEach(delay -> names.add(topology.holdingQueueName(delay)));
        names.addAll(redelivery.knownDelayQueues());
        return new ArrayList<>(names);
    }

    public List<QueueDepth> report() {
        return knownQueueNames().stream()
                .map(name -> {
                    OptionalLong depth = depth(name);
                    return new QueueDepth(name, depth.isPresent() ? depth.getAsLong() : null);
                })
                .collect(Collectors.toList());
    }

    /**
     * 控制台表格
     */
    public static String renderTable(List<QueueDepth> depths) {
        StringBuilder table = new StringBuilder();
        table.append("=== Queue Status ===\n");
        table.append(String.format("%-20s %-10s%n", "Queue Name", "Messages"));
        table.append(Strings.repeat("-", 35)).append('\n');
        for (QueueDepth depth : depths) {
            table.append(String.format("%-20s %-10s%n", depth.getQueueName(), depth.display()));
        }
        return table.toString();
    }
}

package com.example.rabbitretry.session;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * Channel 健康检查
 * 
 * 每次 ack / publish 之前检查会话是否可用：
 * 1. 不可用时跳过操作，返回 SKIPPED，不抛异常
 * 2. 操作本身失败时返回 FAILED，同样不抛异常
 * 
 * 已知缺口：接收消息后会话断开，ack 被跳过，
 * 这条消息交给 Broker 的断线重投处理
 */
@Slf4j
@Component
public class ChannelHealthGuard {

    public GuardResult guarded(BrokerSession session, String operation, GuardedOperation action) {
        SessionState state = session.state();
        if (!state.isUsable()) {
            log.warn("⚠ [Channel Guard] 会话不可用（{}），跳过操作: {}", state, operation);
            return GuardResult.SKIPPED;
        }

        try {
            action.run();
            return GuardResult.OK;
        } catch (Exception e) {
            log.error("✗ [Channel Guard] 操作执行失败: {}, 原因: {}", operation, e.getMessage());
            return GuardResult.FAILED;
        }
    }
}

package com.example.rabbitretry.session;

/**
 * 当前消息所在的 Broker 会话
 * ack / publish 前由 ChannelHealthGuard 查询其状态
 */
@FunctionalInterface
public interface BrokerSession {

    SessionState state();
}

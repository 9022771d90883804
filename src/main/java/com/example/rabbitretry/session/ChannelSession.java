package com.example.rabbitretry.session;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

/**
 * 基于监听器 Channel 的会话
 */
public class ChannelSession implements BrokerSession {

    private final Channel channel;

    public ChannelSession(Channel channel) {
        this.channel = channel;
    }

    @Override
    public SessionState state() {
        if (channel == null || !channel.isOpen()) {
            return SessionState.CLOSED;
        }
        Connection connection = channel.getConnection();
        if (connection != null && !connection.isOpen()) {
            return SessionState.CLOSING;
        }
        return SessionState.OPEN;
    }
}

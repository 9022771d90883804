package com.example.rabbitretry.session;

/**
 * Broker 会话状态
 */
public enum SessionState {
    OPEN,

    /** Channel 仍然打开，但所在连接已经在关闭 */
    CLOSING,

    CLOSED;

    public boolean isUsable() {
        return this == OPEN;
    }
}

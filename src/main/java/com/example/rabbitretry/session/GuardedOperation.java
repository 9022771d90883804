package com.example.rabbitretry.session;

/**
 * 需要会话检查的 ack / publish 操作
 */
@FunctionalInterface
public interface GuardedOperation {

    void run() throws Exception;
}

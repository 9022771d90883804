package com.example.rabbitretry.exception;

/**
 * 永久失败：业务已经确定这条消息无法处理，不需要重试
 * 抛出后消息直接进入死信队列，异常信息作为死信原因
 */
public class PermanentFailureException extends RuntimeException {

    public PermanentFailureException(String message) {
        super(message);
    }
}

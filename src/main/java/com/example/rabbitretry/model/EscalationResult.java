package com.example.rabbitretry.model;

/**
 * 重试调度结果
 */
public enum EscalationResult {
    /** 已发送到延迟队列 */
    SCHEDULED,

    /** 未能发送，调用方需要转入死信 */
    ABANDONED
}

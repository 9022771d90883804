package com.example.rabbitretry.model;

/**
 * 死信投递结果
 */
public enum DeadLetterOutcome {
    DELIVERED,

    /** 死信也没有发出去，消息丢失（只记录日志，不抛异常） */
    LOST
}

package com.example.rabbitretry.model;

/**
 * 消费结果分类
 */
public enum ClassificationType {
    SUCCESS,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE,
    PARSE_ERROR,
    UNEXPECTED_ERROR
}

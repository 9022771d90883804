package com.example.rabbitretry.model;

/**
 * 业务处理的返回结果
 * 永久失败不通过返回值表达，而是抛出 PermanentFailureException
 */
public enum ProcessingOutcome {
    /** 处理成功 */
    SUCCESS,

    /** 临时失败，可以重试 */
    TRANSIENT_FAILURE
}

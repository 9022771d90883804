package com.example.rabbitretry.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 一次消费的分类结果
 * reason 只在失败时有值，作为死信原因使用
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Classification {

    ClassificationType type;

    String reason;

    Throwable cause;

    public static Classification success() {
        return new Classification(ClassificationType.SUCCESS, null, null);
    }

    public static Classification transientFailure() {
        return new Classification(ClassificationType.TRANSIENT_FAILURE, null, null);
    }

    public static Classification permanentFailure(String reason, Throwable cause) {
        return new Classification(ClassificationType.PERMANENT_FAILURE, reason, cause);
    }

    public static Classification parseError(String reason, Throwable cause) {
        return new Classification(ClassificationType.PARSE_ERROR, reason, cause);
    }

    public static Classification unexpectedError(String reason, Throwable cause) {
        return new Classification(ClassificationType.UNEXPECTED_ERROR, reason, cause);
    }
}

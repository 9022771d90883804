package com.example.rabbitretry.model;

import com.example.rabbitretry.service.FallbackChain;
import com.example.rabbitretry.session.GuardResult;

import lombok.Value;

/**
 * 一条消息的最终处置
 * 
 * - classification：分类结果
 * - handledBy：处理成功的步骤（success / escalate / dead-letter），全部失败时为 REPORTED_LOSS
 * - ackResult：最后一步 ack 的结果
 */
@Value
public class Disposition {

    public static final String SUCCESS_STEP = "success";

    ClassificationType classification;

    String handledBy;

    GuardResult ackResult;

    public boolean isReportedLoss() {
        return FallbackChain.REPORTED_LOSS.equals(handledBy);
    }
}

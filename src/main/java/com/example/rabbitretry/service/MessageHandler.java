package com.example.rabbitretry.service;

import com.example.rabbitretry.model.DeliveryMetadata;
import com.example.rabbitretry.model.LogMessage;
import com.example.rabbitretry.model.ProcessingOutcome;

/**
 * 业务处理接口
 * 
 * 约定：
 * 1. 返回 SUCCESS：处理完成
 * 2. 返回 TRANSIENT_FAILURE：临时失败，会进入延迟重试
 * 3. 抛出 PermanentFailureException：永久失败，直接进死信
 * 4. 抛出其他异常：按未知异常处理，同样直接进死信，不重试
 */
@FunctionalInterface
public interface MessageHandler {

    ProcessingOutcome handle(LogMessage message, DeliveryMetadata metadata);
}

package com.sunny.trigger.core.queue;

/**
 * 从队列读到的原始消息，消息体尚未解析
 *
 * @param messageId     消息 ID
 * @param receiptHandle 删除消息用的回执
 * @param body          原始消息体
 * @author SunnyX6
 * @date 2025-12-15
 */
public record ReceivedTrigger(String messageId, String receiptHandle, String body) {
}

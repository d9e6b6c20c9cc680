package com.sunny.trigger.core.message;

/**
 * 触发消息格式错误
 * <p>
 * 缺字段、类型不对或不是合法 JSON，消费端应转入死信队列而不是重试。
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class MalformedTriggerMessageException extends RuntimeException {

    public MalformedTriggerMessageException(String message) {
        super(message);
    }

    public MalformedTriggerMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}

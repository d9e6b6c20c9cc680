package com.sunny.trigger.core.queue;

/**
 * 触发队列调用失败
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class TriggerQueueException extends RuntimeException {

    public TriggerQueueException(String message, Throwable cause) {
        super(message, cause);
    }
}

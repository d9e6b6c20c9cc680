package com.sunny.trigger.store.exception;

/**
 * 调度或执行记录不存在
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}

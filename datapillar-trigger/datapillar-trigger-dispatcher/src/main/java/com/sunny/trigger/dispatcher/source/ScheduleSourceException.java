package com.sunny.trigger.dispatcher.source;

/**
 * 拉取调度失败，本轮分发无法进行
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class ScheduleSourceException extends RuntimeException {

    public ScheduleSourceException(String message) {
        super(message);
    }

    public ScheduleSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}

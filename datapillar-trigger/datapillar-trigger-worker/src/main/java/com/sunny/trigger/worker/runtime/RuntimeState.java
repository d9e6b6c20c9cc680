package com.sunny.trigger.worker.runtime;

/**
 * Worker 运行状态
 * <p>
 * STARTING → RUNNING → {SUCCESS, ERROR, TERMINATED}
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public enum RuntimeState {

    STARTING,
    RUNNING,
    SUCCESS,
    ERROR,
    /**
     * 被终止信号中断
     */
    TERMINATED;

    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == TERMINATED;
    }
}

package com.sunny.trigger.worker.runtime;

/**
 * Worker 调用方式
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public enum WorkerMode {

    /**
     * 接管已存在的执行记录（API 启动路径）
     */
    EXECUTION,

    /**
     * 从触发队列读取一条消息并创建执行记录
     */
    QUEUE
}

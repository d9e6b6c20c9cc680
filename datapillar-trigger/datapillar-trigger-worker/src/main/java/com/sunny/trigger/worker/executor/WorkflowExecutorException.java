package com.sunny.trigger.worker.executor;

/**
 * 调用工作流执行服务失败
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public class WorkflowExecutorException extends RuntimeException {

    public WorkflowExecutorException(String message) {
        super(message);
    }

    public WorkflowExecutorException(String message, Throwable cause) {
        super(message, cause);
    }
}

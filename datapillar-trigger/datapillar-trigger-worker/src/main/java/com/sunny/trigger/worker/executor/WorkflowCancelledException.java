package com.sunny.trigger.worker.executor;

/**
 * 工作流调用因终止信号被取消
 * <p>
 * 终态由终止信号处理器写入，正常路径捕获后不再写库
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public class WorkflowCancelledException extends RuntimeException {

    public WorkflowCancelledException(String message) {
        super(message);
    }

    public WorkflowCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}

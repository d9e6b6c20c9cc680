package com.sunny.trigger.worker.executor;

import com.sunny.trigger.worker.runtime.CancellationToken;

/**
 * 外部工作流执行服务
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public interface WorkflowExecutor {

    /**
     * 同步执行工作流，直到返回结果或被取消
     *
     * @param request 执行请求
     * @param token   取消令牌，终止信号到达时取消
     * @return 执行结果，success=false 为业务失败
     * @throws WorkflowExecutorException  调用失败（网络、非 2xx、响应无法解析）
     * @throws WorkflowCancelledException 调用被取消
     */
    WorkflowExecutionResult execute(WorkflowExecutionRequest request, CancellationToken token);
}

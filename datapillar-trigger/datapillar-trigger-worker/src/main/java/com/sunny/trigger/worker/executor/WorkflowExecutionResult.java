package com.sunny.trigger.worker.executor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 工作流执行结果
 *
 * @param success 是否成功
 * @param error   失败原因
 * @param output  工作流输出
 * @author SunnyX6
 * @date 2025-12-16
 */
public record WorkflowExecutionResult(boolean success, String error, JsonNode output) {

    public static WorkflowExecutionResult ok(JsonNode output) {
        return new WorkflowExecutionResult(true, null, output);
    }

    public static WorkflowExecutionResult fail(String error) {
        return new WorkflowExecutionResult(false, error, null);
    }
}

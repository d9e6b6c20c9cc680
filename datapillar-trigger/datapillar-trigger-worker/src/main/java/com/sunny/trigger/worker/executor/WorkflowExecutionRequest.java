package com.sunny.trigger.worker.executor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 工作流执行请求
 *
 * @param workflowId  工作流 ID
 * @param executionId 执行记录 ID
 * @param input       工作流输入，可为 null
 * @author SunnyX6
 * @date 2025-12-16
 */
public record WorkflowExecutionRequest(String workflowId, String executionId, JsonNode input) {
}

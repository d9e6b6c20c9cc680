package com.sunny.trigger.server.controller;

import com.sunny.trigger.core.enums.TriggerType;
import com.sunny.trigger.server.common.ApiResponse;
import com.sunny.trigger.server.common.ParamValidator;
import com.sunny.trigger.server.dto.ExecutionCreateRequest;
import com.sunny.trigger.store.entity.WorkflowExecution;
import com.sunny.trigger.store.exception.NotFoundException;
import com.sunny.trigger.store.service.WorkflowExecutionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 执行记录
 * <p>
 * 定时执行与其他执行在运行历史里一致展示
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@RestController
public class WorkflowExecutionController {

    private final WorkflowExecutionService executionService;

    public WorkflowExecutionController(WorkflowExecutionService executionService) {
        this.executionService = executionService;
    }

    /**
     * 创建 pending 执行记录，返回的 ID 交给 Worker 以 execution 模式运行
     */
    @PostMapping("/api/workflows/{workflowId}/executions")
    public ApiResponse<WorkflowExecution> create(@PathVariable String workflowId,
                                                 @RequestBody(required = false) ExecutionCreateRequest request) {
        TriggerType triggerType = TriggerType.MANUAL;
        String input = null;
        if (request != null) {
            if (request.getTriggerType() != null) {
                triggerType = TriggerType.of(request.getTriggerType());
            }
            if (triggerType == TriggerType.SCHEDULE) {
                throw new IllegalArgumentException("定时执行只能由调度触发");
            }
            input = request.getInput() == null ? null : request.getInput().toString();
        }
        return ApiResponse.ok(executionService.createPending(workflowId, triggerType, input));
    }

    @GetMapping("/api/workflows/{workflowId}/executions")
    public ApiResponse<List<WorkflowExecution>> list(@PathVariable String workflowId,
                                                     @RequestParam(defaultValue = "20") Integer limit) {
        ParamValidator.requireInRange(limit, 1, 100, "limit");
        return ApiResponse.ok(executionService.listByWorkflow(workflowId, limit));
    }

    @GetMapping("/api/executions/{executionId}")
    public ApiResponse<WorkflowExecution> get(@PathVariable String executionId) {
        WorkflowExecution execution = executionService.getById(executionId);
        if (execution == null) {
            throw new NotFoundException("执行记录不存在: " + executionId);
        }
        return ApiResponse.ok(execution);
    }
}

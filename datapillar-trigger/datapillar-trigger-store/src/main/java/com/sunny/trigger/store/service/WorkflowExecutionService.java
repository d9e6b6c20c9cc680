package com.sunny.trigger.store.service;

import com.sunny.trigger.core.enums.ExecutionStatus;
import com.sunny.trigger.core.enums.TriggerType;
import com.sunny.trigger.core.message.TriggerMessage;
import com.sunny.trigger.store.entity.WorkflowExecution;
import com.sunny.trigger.store.model.TriggerRegistration;

import java.util.List;

/**
 * 工作流执行记录服务
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public interface WorkflowExecutionService {

    /**
     * API 启动路径：创建 pending 记录，随后由 Worker 以 execution 模式接管
     */
    WorkflowExecution createPending(String workflowId, TriggerType triggerType, String input);

    /**
     * 由触发消息创建 running 记录
     * <p>
     * 以 scheduleId + 分钟为幂等键，重复消息返回已有记录并标记 duplicate
     */
    TriggerRegistration createFromTrigger(TriggerMessage message, String input);

    /**
     * pending → running
     *
     * @return 记录已结束或不存在时返回 false
     */
    boolean markRunning(String executionId);

    /**
     * 写入终态，completed_at 已存在时不写
     *
     * @return 本次是否写入
     * @throws com.sunny.trigger.store.exception.NotFoundException 记录不存在
     */
    boolean complete(String executionId, ExecutionStatus status, String error, String output);

    WorkflowExecution getById(String executionId);

    List<WorkflowExecution> listByWorkflow(String workflowId, int limit);
}

package com.sunny.trigger.store.service.impl;

import com.sunny.trigger.core.common.Assert;
import com.sunny.trigger.core.enums.ExecutionStatus;
import com.sunny.trigger.core.enums.TriggerType;
import com.sunny.trigger.core.id.IdGenerator;
import com.sunny.trigger.core.message.TriggerMessage;
import com.sunny.trigger.core.util.ThrowableUtil;
import com.sunny.trigger.store.entity.WorkflowExecution;
import com.sunny.trigger.store.exception.NotFoundException;
import com.sunny.trigger.store.mapper.WorkflowExecutionMapper;
import com.sunny.trigger.store.model.TriggerRegistration;
import com.sunny.trigger.store.service.WorkflowExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 工作流执行记录服务实现
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Service
public class WorkflowExecutionServiceImpl implements WorkflowExecutionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutionServiceImpl.class);

    private static final int MAX_LIST_SIZE = 100;

    private final WorkflowExecutionMapper executionMapper;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public WorkflowExecutionServiceImpl(WorkflowExecutionMapper executionMapper, IdGenerator idGenerator, Clock clock) {
        this.executionMapper = executionMapper;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    public WorkflowExecution createPending(String workflowId, TriggerType triggerType, String input) {
        Assert.notBlank(workflowId, "工作流 ID 不能为空");
        WorkflowExecution execution = new WorkflowExecution();
        execution.setId(idGenerator.nextIdString());
        execution.setWorkflowId(workflowId);
        execution.setTriggerType(triggerType == null ? TriggerType.MANUAL : triggerType);
        execution.setStatus(ExecutionStatus.PENDING);
        execution.setInput(input);
        execution.setCreatedAt(clock.instant());
        executionMapper.insert(execution);
        log.info("创建执行记录: executionId={}, workflowId={}", execution.getId(), workflowId);
        return execution;
    }

    @Override
    public TriggerRegistration createFromTrigger(TriggerMessage message, String input) {
        Assert.notNull(message, "触发消息不能为空");
        Instant now = clock.instant();
        WorkflowExecution execution = new WorkflowExecution();
        execution.setId(idGenerator.nextIdString());
        execution.setWorkflowId(message.workflowId());
        execution.setScheduleId(message.scheduleId());
        execution.setTriggerType(message.triggerType());
        execution.setTriggerKey(message.triggerKey());
        execution.setStatus(ExecutionStatus.RUNNING);
        execution.setInput(input);
        execution.setStartedAt(now);
        execution.setCreatedAt(now);
        try {
            executionMapper.insert(execution);
        } catch (DuplicateKeyException e) {
            WorkflowExecution existing = executionMapper.selectByTriggerKey(message.triggerKey());
            if (existing == null) {
                throw e;
            }
            log.info("重复触发，沿用已有执行记录: triggerKey={}, executionId={}", message.triggerKey(), existing.getId());
            return new TriggerRegistration(existing, true);
        }
        log.info("登记定时执行: executionId={}, workflowId={}, triggerKey={}",
                execution.getId(), message.workflowId(), message.triggerKey());
        return new TriggerRegistration(execution, false);
    }

    @Override
    public boolean markRunning(String executionId) {
        Assert.notBlank(executionId, "执行记录 ID 不能为空");
        return executionMapper.markRunning(executionId, clock.instant()) > 0;
    }

    @Override
    public boolean complete(String executionId, ExecutionStatus status, String error, String output) {
        Assert.notBlank(executionId, "执行记录 ID 不能为空");
        Assert.isTrue(status != null && status.isTerminal(), "终态必须是 success / error / cancelled");

        WorkflowExecution current = executionMapper.selectById(executionId);
        if (current == null) {
            throw new NotFoundException("执行记录不存在: " + executionId);
        }
        if (current.isCompleted()) {
            log.info("执行记录已结束，跳过写入: executionId={}, status={}", executionId, current.getStatus().getCode());
            return false;
        }

        Instant now = clock.instant();
        Long durationMs = current.getStartedAt() == null ? null : Duration.between(current.getStartedAt(), now).toMillis();
        int rows = executionMapper.complete(executionId, status, ThrowableUtil.truncate(error), output, now, durationMs);
        if (rows == 0) {
            log.info("执行记录已被其他路径结束: executionId={}", executionId);
            return false;
        }
        log.info("执行记录结束: executionId={}, status={}, durationMs={}", executionId, status.getCode(), durationMs);
        return true;
    }

    @Override
    public WorkflowExecution getById(String executionId) {
        Assert.notBlank(executionId, "执行记录 ID 不能为空");
        return executionMapper.selectById(executionId);
    }

    @Override
    public List<WorkflowExecution> listByWorkflow(String workflowId, int limit) {
        Assert.notBlank(workflowId, "工作流 ID 不能为空");
        int size = Math.max(1, Math.min(limit, MAX_LIST_SIZE));
        return executionMapper.selectByWorkflowId(workflowId, size);
    }
}

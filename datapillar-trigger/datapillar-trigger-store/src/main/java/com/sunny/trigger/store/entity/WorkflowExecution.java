package com.sunny.trigger.store.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.trigger.core.enums.ExecutionStatus;
import com.sunny.trigger.core.enums.TriggerType;

import java.time.Instant;

/**
 * 工作流执行记录
 * <p>
 * 每次运行一条。completed_at 写入后不再修改状态。
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@TableName("workflow_execution")
public class WorkflowExecution {

    @TableId(type = IdType.ASSIGN_ID)
    private String id;

    private String workflowId;

    /**
     * 定时触发时的调度 ID，其他触发方式为空
     */
    private String scheduleId;

    private TriggerType triggerType;

    /**
     * 幂等键：scheduleId + 分钟，唯一约束
     */
    private String triggerKey;

    private ExecutionStatus status;

    /**
     * 输入参数（JSON）
     */
    private String input;

    /**
     * 输出结果（JSON）
     */
    private String output;

    private String error;

    private Instant startedAt;

    private Instant completedAt;

    private Long durationMs;

    private Instant createdAt;

    public boolean isCompleted() {
        return completedAt != null;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public void setWorkflowId(String workflowId) {
        this.workflowId = workflowId;
    }

    public String getScheduleId() {
        return scheduleId;
    }

    public void setScheduleId(String scheduleId) {
        this.scheduleId = scheduleId;
    }

    public TriggerType getTriggerType() {
        return triggerType;
    }

    public void setTriggerType(TriggerType triggerType) {
        this.triggerType = triggerType;
    }

    public String getTriggerKey() {
        return triggerKey;
    }

    public void setTriggerKey(String triggerKey) {
        this.triggerKey = triggerKey;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    public void setStatus(ExecutionStatus status) {
        this.status = status;
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Long getDurationMs() {
        return durationMs;
    }

    public void setDurationMs(Long durationMs) {
        this.durationMs = durationMs;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}

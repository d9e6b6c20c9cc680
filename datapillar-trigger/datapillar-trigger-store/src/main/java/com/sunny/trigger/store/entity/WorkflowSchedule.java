package com.sunny.trigger.store.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.sunny.trigger.core.enums.ScheduleRunStatus;

import java.time.Instant;

/**
 * 工作流调度实体
 * <p>
 * 每个带定时触发器的工作流一条记录，workflow_id 唯一。
 * cron_expression / timezone 在写入前已校验。
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@TableName("workflow_schedule")
public class WorkflowSchedule {

    @TableId(type = IdType.ASSIGN_ID)
    private String id;

    private String workflowId;

    /**
     * 5 段或 6 段 Cron 表达式
     */
    private String cronExpression;

    /**
     * IANA 时区名
     */
    private String timezone;

    private Boolean enabled;

    private Instant lastRunAt;

    private ScheduleRunStatus lastStatus;

    private String lastError;

    /**
     * 下一次触发时间，同步配置与每次运行后刷新
     */
    private Instant nextRunAt;

    /**
     * 成功运行次数
     */
    private Long runCount;

    private Instant createdAt;

    private Instant updatedAt;

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

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public ScheduleRunStatus getLastStatus() {
        return lastStatus;
    }

    public void setLastStatus(ScheduleRunStatus lastStatus) {
        this.lastStatus = lastStatus;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Long getRunCount() {
        return runCount;
    }

    public void setRunCount(Long runCount) {
        this.runCount = runCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}

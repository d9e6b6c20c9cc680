package com.sunny.trigger.store.service.impl;

import com.sunny.trigger.core.common.Assert;
import com.sunny.trigger.core.common.Constants;
import com.sunny.trigger.core.cron.CronEvaluator;
import com.sunny.trigger.core.cron.CronUtils;
import com.sunny.trigger.core.cron.CronValidation;
import com.sunny.trigger.core.enums.ScheduleRunStatus;
import com.sunny.trigger.core.enums.TriggerType;
import com.sunny.trigger.core.id.IdGenerator;
import com.sunny.trigger.core.util.ThrowableUtil;
import com.sunny.trigger.store.entity.WorkflowSchedule;
import com.sunny.trigger.store.exception.NotFoundException;
import com.sunny.trigger.store.mapper.WorkflowScheduleMapper;
import com.sunny.trigger.store.model.SyncResult;
import com.sunny.trigger.store.model.TriggerConfig;
import com.sunny.trigger.store.service.WorkflowScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

/**
 * 工作流调度服务实现
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Service
public class WorkflowScheduleServiceImpl implements WorkflowScheduleService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowScheduleServiceImpl.class);

    private final WorkflowScheduleMapper scheduleMapper;
    private final CronEvaluator cronEvaluator;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public WorkflowScheduleServiceImpl(WorkflowScheduleMapper scheduleMapper,
                                       CronEvaluator cronEvaluator,
                                       IdGenerator idGenerator,
                                       Clock clock) {
        this.scheduleMapper = scheduleMapper;
        this.cronEvaluator = cronEvaluator;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    @Override
    public CronValidation validateCronExpression(String cronExpression) {
        return CronUtils.validate(cronExpression);
    }

    @Override
    public boolean validateTimezone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return false;
        }
        try {
            ZoneId.of(timezone);
            return true;
        } catch (DateTimeException e) {
            return false;
        }
    }

    @Override
    public SyncResult syncSchedule(String workflowId, TriggerConfig config) {
        Assert.notBlank(workflowId, "工作流 ID 不能为空");
        Assert.notNull(config, "触发器配置不能为空");
        TriggerType triggerType = TriggerType.of(Assert.notBlank(config.getTriggerType(), "触发类型不能为空"));

        if (triggerType != TriggerType.SCHEDULE) {
            int deleted = scheduleMapper.deleteByWorkflowId(workflowId);
            if (deleted > 0) {
                log.info("触发类型变更为 {}，删除调度: workflowId={}", triggerType.getCode(), workflowId);
                return new SyncResult(SyncResult.Action.DELETED, null);
            }
            return new SyncResult(SyncResult.Action.NONE, null);
        }

        String cronExpression = Assert.notBlank(config.getCronExpression(), "Cron 表达式不能为空").trim();
        String timezone = config.getTimezone() == null || config.getTimezone().isBlank()
                ? Constants.DEFAULT_TIMEZONE
                : config.getTimezone().trim();

        CronValidation validation = validateCronExpression(cronExpression);
        Assert.isTrue(validation.valid(), "Cron 表达式无效: " + validation.error());
        Assert.isTrue(validateTimezone(timezone), "时区无效: " + timezone);

        Instant now = clock.instant();
        Instant nextRunAt = cronEvaluator.computeNextRunTime(cronExpression, timezone, now);

        WorkflowSchedule existing = scheduleMapper.selectByWorkflowId(workflowId);
        if (existing != null) {
            scheduleMapper.updateDefinition(existing.getId(), cronExpression, timezone, nextRunAt, now);
            existing.setCronExpression(cronExpression);
            existing.setTimezone(timezone);
            existing.setNextRunAt(nextRunAt);
            existing.setUpdatedAt(now);
            log.info("更新调度: workflowId={}, cron={}, timezone={}, nextRunAt={}",
                    workflowId, cronExpression, timezone, nextRunAt);
            return new SyncResult(SyncResult.Action.UPDATED, existing);
        }

        WorkflowSchedule schedule = new WorkflowSchedule();
        schedule.setId(idGenerator.nextIdString());
        schedule.setWorkflowId(workflowId);
        schedule.setCronExpression(cronExpression);
        schedule.setTimezone(timezone);
        schedule.setEnabled(true);
        schedule.setNextRunAt(nextRunAt);
        schedule.setRunCount(0L);
        schedule.setCreatedAt(now);
        schedule.setUpdatedAt(now);
        scheduleMapper.insert(schedule);
        log.info("创建调度: workflowId={}, scheduleId={}, cron={}, timezone={}, nextRunAt={}",
                workflowId, schedule.getId(), cronExpression, timezone, nextRunAt);
        return new SyncResult(SyncResult.Action.CREATED, schedule);
    }

    @Override
    public boolean updateAfterRun(String scheduleId, ScheduleRunStatus status, String error) {
        Assert.notBlank(scheduleId, "调度 ID 不能为空");
        Assert.notNull(status, "运行状态不能为空");

        WorkflowSchedule schedule = scheduleMapper.selectById(scheduleId);
        if (schedule == null) {
            log.warn("调度不存在，忽略运行结果: scheduleId={}, status={}", scheduleId, status.getCode());
            return false;
        }

        Instant now = clock.instant();
        Instant nextRunAt = cronEvaluator.computeNextRunTime(schedule.getCronExpression(), schedule.getTimezone(), now);
        boolean success = status == ScheduleRunStatus.SUCCESS;
        String lastError = success ? null : ThrowableUtil.truncate(error);

        int rows = scheduleMapper.updateRunResult(scheduleId, status, lastError, now, nextRunAt, success);
        log.info("记录调度运行结果: scheduleId={}, status={}, nextRunAt={}", scheduleId, status.getCode(), nextRunAt);
        return rows > 0;
    }

    @Override
    public WorkflowSchedule setEnabled(String workflowId, boolean enabled) {
        Assert.notBlank(workflowId, "工作流 ID 不能为空");
        WorkflowSchedule schedule = scheduleMapper.selectByWorkflowId(workflowId);
        if (schedule == null) {
            throw new NotFoundException("工作流没有调度: " + workflowId);
        }

        Instant now = clock.instant();
        Instant nextRunAt = enabled
                ? cronEvaluator.computeNextRunTime(schedule.getCronExpression(), schedule.getTimezone(), now)
                : null;
        scheduleMapper.updateEnabled(workflowId, enabled, nextRunAt, now);
        schedule.setEnabled(enabled);
        schedule.setNextRunAt(nextRunAt);
        schedule.setUpdatedAt(now);
        log.info("{}调度: workflowId={}, scheduleId={}", enabled ? "启用" : "停用", workflowId, schedule.getId());
        return schedule;
    }

    @Override
    public WorkflowSchedule getById(String scheduleId) {
        Assert.notBlank(scheduleId, "调度 ID 不能为空");
        return scheduleMapper.selectById(scheduleId);
    }

    @Override
    public WorkflowSchedule getByWorkflowId(String workflowId) {
        Assert.notBlank(workflowId, "工作流 ID 不能为空");
        return scheduleMapper.selectByWorkflowId(workflowId);
    }

    @Override
    public List<WorkflowSchedule> listEnabled() {
        return scheduleMapper.selectEnabled();
    }
}

package com.sunny.trigger.store.service;

import com.sunny.trigger.core.cron.CronValidation;
import com.sunny.trigger.core.enums.ScheduleRunStatus;
import com.sunny.trigger.store.entity.WorkflowSchedule;
import com.sunny.trigger.store.model.SyncResult;
import com.sunny.trigger.store.model.TriggerConfig;

import java.util.List;

/**
 * 工作流调度服务
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public interface WorkflowScheduleService {

    /**
     * 校验 Cron 表达式：先检查字段数（5 或 6），再完整解析
     */
    CronValidation validateCronExpression(String cronExpression);

    /**
     * 校验 IANA 时区名
     */
    boolean validateTimezone(String timezone);

    /**
     * 按工作流当前触发器配置同步调度
     * <p>
     * 非定时触发删除调度；定时触发校验后更新或新建，并刷新 nextRunAt。
     * 工作流保存时调用，不在每分钟的分发路径上。
     *
     * @throws IllegalArgumentException Cron 表达式或时区无效
     */
    SyncResult syncSchedule(String workflowId, TriggerConfig config);

    /**
     * 记录一次运行结果
     * <p>
     * 按当前 Cron 配置重新计算 nextRunAt，只有 SUCCESS 增加 runCount，
     * lastError 只在 ERROR 时写入。
     *
     * @return 调度不存在时返回 false
     */
    boolean updateAfterRun(String scheduleId, ScheduleRunStatus status, String error);

    /**
     * 启用或停用调度
     *
     * @throws com.sunny.trigger.store.exception.NotFoundException 工作流没有调度
     */
    WorkflowSchedule setEnabled(String workflowId, boolean enabled);

    WorkflowSchedule getById(String scheduleId);

    WorkflowSchedule getByWorkflowId(String workflowId);

    List<WorkflowSchedule> listEnabled();
}

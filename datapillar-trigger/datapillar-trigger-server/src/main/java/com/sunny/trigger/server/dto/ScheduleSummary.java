package com.sunny.trigger.server.dto;

import com.sunny.trigger.store.entity.WorkflowSchedule;

/**
 * Dispatcher 拉取的调度条目
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public record ScheduleSummary(String id, String workflowId, String cronExpression, String timezone, boolean enabled) {

    public static ScheduleSummary from(WorkflowSchedule schedule) {
        return new ScheduleSummary(schedule.getId(), schedule.getWorkflowId(), schedule.getCronExpression(),
                schedule.getTimezone(), schedule.isEnabled());
    }
}

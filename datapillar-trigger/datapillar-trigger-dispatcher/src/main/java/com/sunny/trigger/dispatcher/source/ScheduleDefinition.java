package com.sunny.trigger.dispatcher.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * 调度来源返回的调度条目
 *
 * @param enabled 来源未返回时视为启用
 * @author SunnyX6
 * @date 2025-12-15
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScheduleDefinition(String id, String workflowId, String cronExpression, String timezone, Boolean enabled) {

    public boolean isEnabled() {
        return enabled == null || enabled;
    }
}

package com.sunny.trigger.store.model;

import com.sunny.trigger.store.entity.WorkflowExecution;

/**
 * 由触发消息登记执行记录的结果
 *
 * @param execution 执行记录（重复时为已存在的那条）
 * @param duplicate 同一调度同一分钟已登记过
 * @author SunnyX6
 * @date 2025-12-15
 */
public record TriggerRegistration(WorkflowExecution execution, boolean duplicate) {
}

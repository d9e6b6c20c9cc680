package com.sunny.trigger.store.model;

import com.sunny.trigger.store.entity.WorkflowSchedule;

/**
 * 调度同步结果
 *
 * @param action   执行的动作
 * @param schedule 同步后的调度，删除或无动作时为 null
 * @author SunnyX6
 * @date 2025-12-15
 */
public record SyncResult(Action action, WorkflowSchedule schedule) {

    public enum Action {
        CREATED,
        UPDATED,
        DELETED,
        /**
         * 非定时触发且原本没有调度
         */
        NONE
    }
}

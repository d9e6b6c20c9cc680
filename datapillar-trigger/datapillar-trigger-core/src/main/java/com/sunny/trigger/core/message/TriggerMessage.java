package com.sunny.trigger.core.message;

import com.sunny.trigger.core.enums.TriggerType;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * 定时触发消息
 * <p>
 * Dispatcher 判定触发后写入队列，Worker 消费。消息只携带数据，
 * Worker 不再重新判定是否应该触发。
 *
 * @param workflowId  工作流 ID
 * @param scheduleId  调度 ID
 * @param triggerTime 评估时刻（Dispatcher 的 now）
 * @param triggerType 固定为 schedule
 * @author SunnyX6
 * @date 2025-12-15
 */
public record TriggerMessage(String workflowId, String scheduleId, Instant triggerTime, TriggerType triggerType) {

    public static TriggerMessage schedule(String workflowId, String scheduleId, Instant triggerTime) {
        return new TriggerMessage(workflowId, scheduleId, triggerTime, TriggerType.SCHEDULE);
    }

    /**
     * 幂等键：调度 ID + 截断到分钟的触发时间
     * <p>
     * 同一分钟窗口内的重复分发与队列重投都映射到同一个键。
     */
    public String triggerKey() {
        return scheduleId + ":" + triggerTime.truncatedTo(ChronoUnit.MINUTES);
    }
}

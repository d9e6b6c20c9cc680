package com.sunny.trigger.core.cron;

import java.time.Instant;

/**
 * 单次窗口评估结果
 *
 * @param shouldFire 本窗口是否触发
 * @param previous   不晚于 now 的最近一次触发时间，无法计算时为 null
 * @param error      解析或计算错误，正常时为 null
 * @author SunnyX6
 * @date 2025-12-13
 */
public record CronEvaluation(boolean shouldFire, Instant previous, String error) {

    public static CronEvaluation of(boolean shouldFire, Instant previous) {
        return new CronEvaluation(shouldFire, previous, null);
    }

    public static CronEvaluation failed(String error) {
        return new CronEvaluation(false, null, error);
    }

    public boolean hasError() {
        return error != null;
    }
}

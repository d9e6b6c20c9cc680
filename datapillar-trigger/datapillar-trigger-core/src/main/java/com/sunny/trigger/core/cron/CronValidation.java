package com.sunny.trigger.core.cron;

/**
 * Cron 表达式校验结果
 *
 * @param valid 是否有效
 * @param error 第一个错误，有效时为 null
 * @author SunnyX6
 * @date 2025-12-13
 */
public record CronValidation(boolean valid, String error) {

    public static CronValidation ok() {
        return new CronValidation(true, null);
    }

    public static CronValidation fail(String error) {
        return new CronValidation(false, error);
    }
}

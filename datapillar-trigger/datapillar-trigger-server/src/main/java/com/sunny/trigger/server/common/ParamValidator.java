package com.sunny.trigger.server.common;

/**
 * 参数校验工具类
 * <p>
 * 校验失败时抛出 IllegalArgumentException，由 GlobalExceptionHandler 统一处理
 *
 * @author SunnyX6
 * @date 2025-12-14
 */
public final class ParamValidator {

    private ParamValidator() {
    }

    public static void requireNotBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " 不能为空");
        }
    }

    public static void requireNotNull(Object value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " 不能为空");
        }
    }

    public static void requireInRange(Integer value, int min, int max, String fieldName) {
        requireNotNull(value, fieldName);
        if (value < min || value > max) {
            throw new IllegalArgumentException(fieldName + " 必须在 " + min + " 到 " + max + " 之间");
        }
    }
}

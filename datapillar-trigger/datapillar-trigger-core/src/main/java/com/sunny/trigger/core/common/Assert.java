package com.sunny.trigger.core.common;

/**
 * 断言工具类
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public final class Assert {

    private Assert() {
    }

    /**
     * 断言表达式为 true
     */
    public static void isTrue(boolean expression, String message) {
        if (!expression) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * 断言对象不为 null
     */
    public static <T> T notNull(T object, String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * 断言字符串不为空白
     */
    public static String notBlank(String text, String message) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException(message);
        }
        return text;
    }

    /**
     * 断言状态，失败抛出 IllegalStateException
     */
    public static void state(boolean expression, String message) {
        if (!expression) {
            throw new IllegalStateException(message);
        }
    }
}

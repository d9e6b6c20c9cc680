package com.sunny.trigger.core.util;

/**
 * 异常信息提取
 *
 * @author Sunny
 * @since 2025-12-08
 */
public final class ThrowableUtil {

    /**
     * 写入 error 字段的最大长度
     */
    public static final int MAX_MESSAGE_LENGTH = 2000;

    private ThrowableUtil() {
    }

    /**
     * 取最内层异常的消息，没有消息时使用类名
     */
    public static String rootMessage(Throwable e) {
        if (e == null) {
            return null;
        }
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        return truncate(message);
    }

    public static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE_LENGTH);
    }
}

package com.sunny.trigger.core.common;

import java.time.Duration;

/**
 * 常量定义
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public final class Constants {

    private Constants() {
    }

    // ==================== 调度常量 ====================

    /**
     * 默认时区
     */
    public static final String DEFAULT_TIMEZONE = "UTC";

    /**
     * 分发窗口，等于 Dispatcher 的调用周期
     */
    public static final Duration DEFAULT_FIRE_WINDOW = Duration.ofMinutes(1);

    // ==================== 服务间认证 ====================

    /**
     * 服务间共享密钥请求头
     */
    public static final String SERVICE_KEY_HEADER = "X-Service-Key";

    // ==================== 队列消息属性 ====================

    public static final String ATTR_TRIGGER_TYPE = "TriggerType";

    public static final String ATTR_WORKFLOW_ID = "WorkflowId";

    public static final String ATTR_DEAD_LETTER_REASON = "DeadLetterReason";

    // ==================== 进程退出码 ====================

    /**
     * 执行结果已持久化（成功或业务失败）
     */
    public static final int EXIT_RECORDED = 0;

    /**
     * 系统级失败：信号终止、未记录的致命错误、数据库不可达
     */
    public static final int EXIT_SYSTEM_FAILURE = 1;
}

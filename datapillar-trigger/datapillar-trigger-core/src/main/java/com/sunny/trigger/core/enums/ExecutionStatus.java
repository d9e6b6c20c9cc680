package com.sunny.trigger.core.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流执行状态
 * <p>
 * 状态流转：
 * <pre>
 * PENDING ──Worker 启动──→ RUNNING ──执行成功──→ SUCCESS
 *                            │
 *                            ├──执行失败 / 终止信号──→ ERROR
 *                            │
 *                            └──人工取消──→ CANCELLED
 * </pre>
 * completed_at 写入后状态不再变化。
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public enum ExecutionStatus {

    PENDING("pending", "等待中"),
    RUNNING("running", "运行中"),
    SUCCESS("success", "成功"),
    ERROR("error", "失败"),
    CANCELLED("cancelled", "取消");

    private final String code;
    private final String desc;

    ExecutionStatus(String code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }

    /**
     * 是否为终态
     */
    public boolean isTerminal() {
        return this == SUCCESS || this == ERROR || this == CANCELLED;
    }

    public static ExecutionStatus of(String code) {
        for (ExecutionStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知的执行状态: " + code);
    }
}

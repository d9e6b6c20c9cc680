package com.sunny.trigger.core.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 调度最近一次运行结果
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public enum ScheduleRunStatus {

    SUCCESS("success", "成功"),
    ERROR("error", "失败");

    private final String code;
    private final String desc;

    ScheduleRunStatus(String code, String desc) {
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
     * 由执行终态映射调度结果，只有 SUCCESS 计为成功
     */
    public static ScheduleRunStatus fromExecution(ExecutionStatus status) {
        return status == ExecutionStatus.SUCCESS ? SUCCESS : ERROR;
    }

    public static ScheduleRunStatus of(String code) {
        for (ScheduleRunStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("未知的调度运行状态: " + code);
    }
}

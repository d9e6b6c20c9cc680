package com.sunny.trigger.core.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 工作流触发类型
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public enum TriggerType {

    MANUAL("manual", "手动触发"),
    SCHEDULE("schedule", "定时触发"),
    WEBHOOK("webhook", "Webhook 触发");

    private final String code;
    private final String desc;

    TriggerType(String code, String desc) {
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

    public static TriggerType of(String code) {
        for (TriggerType type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("未知的触发类型: " + code);
    }
}

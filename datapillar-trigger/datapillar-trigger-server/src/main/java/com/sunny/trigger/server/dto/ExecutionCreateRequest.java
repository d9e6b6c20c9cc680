package com.sunny.trigger.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 创建执行记录请求
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class ExecutionCreateRequest {

    /**
     * manual / webhook，为空时为 manual
     */
    private String triggerType;

    private JsonNode input;

    public String getTriggerType() {
        return triggerType;
    }

    public void setTriggerType(String triggerType) {
        this.triggerType = triggerType;
    }

    public JsonNode getInput() {
        return input;
    }

    public void setInput(JsonNode input) {
        this.input = input;
    }
}

package com.sunny.trigger.store.model;

/**
 * 工作流触发器配置
 * <p>
 * 工作流保存时由编辑端传入，triggerType 不是 schedule 时其余字段忽略
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class TriggerConfig {

    /**
     * manual / schedule / webhook
     */
    private String triggerType;

    private String cronExpression;

    /**
     * 为空时使用 UTC
     */
    private String timezone;

    public TriggerConfig() {
    }

    public TriggerConfig(String triggerType, String cronExpression, String timezone) {
        this.triggerType = triggerType;
        this.cronExpression = cronExpression;
        this.timezone = timezone;
    }

    public static TriggerConfig schedule(String cronExpression, String timezone) {
        return new TriggerConfig("schedule", cronExpression, timezone);
    }

    public String getTriggerType() {
        return triggerType;
    }

    public void setTriggerType(String triggerType) {
        this.triggerType = triggerType;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }
}

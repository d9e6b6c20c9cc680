package com.sunny.trigger.server.dto;

/**
 * 运行结果回写请求
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public class ScheduleRunReport {

    /**
     * success / error
     */
    private String status;

    private String error;

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}

package com.sunny.trigger.worker.config;

import com.sunny.trigger.worker.runtime.WorkerMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Worker 配置
 * <p>
 * 参数由启动方通过环境变量传入，一个进程只处理一次执行
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
@Component
@ConfigurationProperties(prefix = "datapillar.trigger.worker")
public class WorkerProperties {

    private WorkerMode mode = WorkerMode.EXECUTION;

    // ==================== execution 模式参数 ====================

    private String workflowId;

    private String executionId;

    /**
     * 定时触发时传入，手动执行为空
     */
    private String scheduleId;

    /**
     * JSON 字符串
     */
    private String input;

    // ==================== 工作流执行服务 ====================

    private String executorBaseUrl = "http://localhost:3000";

    private String serviceKey;

    private Duration executorConnectTimeout = Duration.ofSeconds(10);

    private Duration executorTimeout = Duration.ofMinutes(15);

    // ==================== 关闭时限 ====================

    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    private Duration shutdownBuffer = Duration.ofSeconds(5);

    public WorkerMode getMode() {
        return mode;
    }

    public void setMode(WorkerMode mode) {
        this.mode = mode;
    }

    public String getWorkflowId() {
        return workflowId;
    }

    public void setWorkflowId(String workflowId) {
        this.workflowId = workflowId;
    }

    public String getExecutionId() {
        return executionId;
    }

    public void setExecutionId(String executionId) {
        this.executionId = executionId;
    }

    public String getScheduleId() {
        return scheduleId;
    }

    public void setScheduleId(String scheduleId) {
        this.scheduleId = scheduleId;
    }

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getExecutorBaseUrl() {
        return executorBaseUrl;
    }

    public void setExecutorBaseUrl(String executorBaseUrl) {
        this.executorBaseUrl = executorBaseUrl;
    }

    public String getServiceKey() {
        return serviceKey;
    }

    public void setServiceKey(String serviceKey) {
        this.serviceKey = serviceKey;
    }

    public Duration getExecutorConnectTimeout() {
        return executorConnectTimeout;
    }

    public void setExecutorConnectTimeout(Duration executorConnectTimeout) {
        this.executorConnectTimeout = executorConnectTimeout;
    }

    public Duration getExecutorTimeout() {
        return executorTimeout;
    }

    public void setExecutorTimeout(Duration executorTimeout) {
        this.executorTimeout = executorTimeout;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public Duration getShutdownBuffer() {
        return shutdownBuffer;
    }

    public void setShutdownBuffer(Duration shutdownBuffer) {
        this.shutdownBuffer = shutdownBuffer;
    }
}

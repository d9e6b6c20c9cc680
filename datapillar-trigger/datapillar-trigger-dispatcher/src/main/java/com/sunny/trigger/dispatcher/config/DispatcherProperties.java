package com.sunny.trigger.dispatcher.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Dispatcher 配置
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Component
@ConfigurationProperties(prefix = "datapillar.trigger.dispatcher")
public class DispatcherProperties {

    /**
     * 调度来源（Trigger Server）地址
     */
    private String scheduleSourceUrl = "http://localhost:8080";

    /**
     * 服务间共享密钥
     */
    private String serviceKey;

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration requestTimeout = Duration.ofSeconds(30);

    /**
     * 触发窗口，必须等于外部调用周期
     */
    private Duration window = Duration.ofMinutes(1);

    public String getScheduleSourceUrl() {
        return scheduleSourceUrl;
    }

    public void setScheduleSourceUrl(String scheduleSourceUrl) {
        this.scheduleSourceUrl = scheduleSourceUrl;
    }

    public String getServiceKey() {
        return serviceKey;
    }

    public void setServiceKey(String serviceKey) {
        this.serviceKey = serviceKey;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }
}

package com.sunny.trigger.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 服务间认证配置
 * <p>
 * Dispatcher 与 Worker 访问 /api/internal/** 时携带的共享密钥
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Component
@ConfigurationProperties(prefix = "datapillar.trigger.security")
public class ServiceKeyProperties {

    private String serviceKey;

    /**
     * 需要服务密钥的路径前缀
     */
    private String internalPathPrefix = "/api/internal/";

    public String getServiceKey() {
        return serviceKey;
    }

    public void setServiceKey(String serviceKey) {
        this.serviceKey = serviceKey;
    }

    public String getInternalPathPrefix() {
        return internalPathPrefix;
    }

    public void setInternalPathPrefix(String internalPathPrefix) {
        this.internalPathPrefix = internalPathPrefix;
    }
}

package com.sunny.trigger.server;

import com.sunny.trigger.store.config.TriggerStoreConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

/**
 * Datapillar Trigger Server 启动类
 * <p>
 * 职责：
 * - 为 Dispatcher 提供启用调度列表（服务密钥认证）
 * - 接收运行结果回写调度状态
 * - 工作流保存时同步调度配置
 * - 执行记录查询
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@SpringBootApplication
@Import(TriggerStoreConfig.class)
public class DatapillarTriggerServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(DatapillarTriggerServerApplication.class, args);
    }
}

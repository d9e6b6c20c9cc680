package com.sunny.trigger.store.config;

import com.sunny.trigger.core.cron.CronEvaluator;
import com.sunny.trigger.core.common.Constants;
import com.sunny.trigger.core.id.IdGenerator;
import org.mybatis.spring.annotation.MapperScan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;

/**
 * 存储模块装配
 * <p>
 * Server 与 Worker 通过 @Import 引入
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Configuration
@Import(MybatisPlusConfig.class)
@MapperScan("com.sunny.trigger.store.mapper")
@ComponentScan("com.sunny.trigger.store.service")
public class TriggerStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TriggerStoreConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public CronEvaluator cronEvaluator(Clock clock) {
        return new CronEvaluator(Constants.DEFAULT_FIRE_WINDOW, clock);
    }

    /**
     * 节点 ID 未配置时由主机名派生
     */
    @Bean
    @ConditionalOnMissingBean
    public IdGenerator idGenerator(@Value("${datapillar.trigger.node-id:-1}") int nodeId) {
        if (nodeId >= 0) {
            return new IdGenerator(nodeId);
        }
        String address;
        try {
            address = InetAddress.getLocalHost().getHostName() + ":" + ProcessHandle.current().pid();
        } catch (UnknownHostException e) {
            log.warn("获取主机名失败，使用进程号派生节点 ID: {}", e.getMessage());
            address = "pid:" + ProcessHandle.current().pid();
        }
        return IdGenerator.fromAddress(address);
    }
}

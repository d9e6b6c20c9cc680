package com.sunny.trigger.store.config;

import com.baomidou.mybatisplus.autoconfigure.ConfigurationCustomizer;
import com.baomidou.mybatisplus.core.incrementer.IdentifierGenerator;
import com.sunny.trigger.core.id.IdGenerator;
import com.sunny.trigger.store.handler.ExecutionStatusTypeHandler;
import com.sunny.trigger.store.handler.ScheduleRunStatusTypeHandler;
import com.sunny.trigger.store.handler.TriggerTypeTypeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatis-Plus 配置
 * <p>
 * 注册枚举类型处理器，并把 Snowflake ID 生成器接到 ASSIGN_ID 上
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Configuration
public class MybatisPlusConfig {

    private static final Logger log = LoggerFactory.getLogger(MybatisPlusConfig.class);

    @Bean
    public IdentifierGenerator identifierGenerator(IdGenerator idGenerator) {
        log.info("配置 MyBatis-Plus ID 生成器: nodeId={}", idGenerator.getNodeId());
        return entity -> idGenerator.nextId();
    }

    @Bean
    public ConfigurationCustomizer enumTypeHandlerCustomizer() {
        return configuration -> {
            configuration.getTypeHandlerRegistry().register(ExecutionStatusTypeHandler.class);
            configuration.getTypeHandlerRegistry().register(ScheduleRunStatusTypeHandler.class);
            configuration.getTypeHandlerRegistry().register(TriggerTypeTypeHandler.class);
        };
    }
}

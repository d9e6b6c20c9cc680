package com.sunny.trigger.dispatcher;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Datapillar Trigger Dispatcher 启动类
 * <p>
 * 由外部调度（如系统 cron）每分钟调用一次，执行一轮分发后退出，
 * 进程内没有定时器与后台线程。退出码：0 全部成功，1 有入队失败或致命错误。
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@SpringBootApplication
public class DatapillarTriggerDispatcherApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(DatapillarTriggerDispatcherApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        ConfigurableApplicationContext context = application.run(args);
        System.exit(SpringApplication.exit(context));
    }
}

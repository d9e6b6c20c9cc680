package com.sunny.trigger.worker;

import com.sunny.trigger.worker.runtime.OutcomeRecorder;
import com.sunny.trigger.worker.runtime.ProcessTerminator;
import com.sunny.trigger.worker.runtime.RuntimeContext;
import com.sunny.trigger.worker.runtime.ShutdownHandler;
import com.sunny.trigger.worker.runtime.ShutdownTimeouts;
import com.sunny.trigger.worker.runtime.WorkerRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Datapillar Trigger Worker 启动类
 * <p>
 * Worker 职责：
 * - 每个进程只处理一次执行，处理完即退出
 * - 直接读写 DB，结果记录后以 0 退出
 * - 终止信号由 ShutdownHandler 接管，Spring 自带的关闭钩子不注册
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
@SpringBootApplication
public class DatapillarTriggerWorkerApplication {

    private static final Logger log = LoggerFactory.getLogger(DatapillarTriggerWorkerApplication.class);

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(DatapillarTriggerWorkerApplication.class);
        application.setWebApplicationType(WebApplicationType.NONE);
        application.setRegisterShutdownHook(false);
        ConfigurableApplicationContext context = application.run(args);

        ShutdownHandler shutdownHandler = new ShutdownHandler(
                context.getBean(RuntimeContext.class),
                context.getBean(OutcomeRecorder.class),
                context.getBean(ShutdownTimeouts.class),
                ProcessTerminator.halt(),
                context::close);
        shutdownHandler.install();

        int exitCode = context.getBean(WorkerRuntime.class).run();
        if (!shutdownHandler.disarm()) {
            log.info("终止信号处理中，由关闭钩子完成收尾: exitCode={}", exitCode);
            return;
        }
        context.close();
        System.exit(exitCode);
    }
}

package com.sunny.trigger.dispatcher.dispatch;

import com.sunny.trigger.core.common.Constants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 启动即执行一轮分发，结果映射为进程退出码
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Component
public class DispatchRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(DispatchRunner.class);

    private final ScheduleDispatcher dispatcher;
    private final Clock clock;

    private volatile int exitCode = Constants.EXIT_RECORDED;

    public DispatchRunner(ScheduleDispatcher dispatcher, Clock clock) {
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        try {
            DispatchReport report = dispatcher.dispatch(clock.instant());
            exitCode = report.exitCode();
        } catch (Exception e) {
            log.error("分发失败，本轮中止", e);
            exitCode = Constants.EXIT_SYSTEM_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

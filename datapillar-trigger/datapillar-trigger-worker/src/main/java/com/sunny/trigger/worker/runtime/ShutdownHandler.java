package com.sunny.trigger.worker.runtime;

import com.sunny.trigger.core.common.Constants;
import com.sunny.trigger.core.enums.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 终止信号处理器，以 JVM 关闭钩子运行
 * <p>
 * 流程：
 * 1. 取消令牌，中断正在进行的工作流调用
 * 2. 启动看门狗，超过关闭时限直接以 1 终止进程
 * 3. 抢到终态守卫则写入 error；否则等待正常路径写完，自身不写
 * 4. 关闭应用上下文，以 1 终止进程
 * <p>
 * 收尾权只归一方：正常路径 disarm 成功则由它关闭上下文并退出，随后 System.exit 触发的钩子直接返回；
 * 钩子先开始运行则 disarm 失败，正常路径不得关闭上下文，由钩子写完终态后关闭并终止。
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public class ShutdownHandler implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ShutdownHandler.class);

    public static final String TERMINATED_MESSAGE = "工作流被终止信号中断";

    private final RuntimeContext context;
    private final OutcomeRecorder recorder;
    private final ShutdownTimeouts timeouts;
    private final ProcessTerminator terminator;
    private final Runnable contextCloser;
    private final AtomicBoolean armed = new AtomicBoolean(true);

    public ShutdownHandler(RuntimeContext context, OutcomeRecorder recorder, ShutdownTimeouts timeouts,
                           ProcessTerminator terminator, Runnable contextCloser) {
        this.context = context;
        this.recorder = recorder;
        this.timeouts = timeouts;
        this.terminator = terminator;
        this.contextCloser = contextCloser;
    }

    /**
     * 正常路径退出前调用
     *
     * @return 是否拿到收尾权；false 表示钩子已在运行，上下文的关闭与进程终止归钩子
     */
    public boolean disarm() {
        return armed.compareAndSet(true, false);
    }

    /**
     * 注册为 JVM 关闭钩子
     */
    public Thread install() {
        Thread hook = new Thread(this, "worker-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    @Override
    public void run() {
        if (!armed.compareAndSet(true, false)) {
            return;
        }
        Duration timeout = timeouts.shutdownTimeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        log.warn("收到终止信号，开始关闭: shutdownTimeout={}ms", timeout.toMillis());

        Thread watchdog = startWatchdog(timeout);
        try {
            context.getToken().cancel();
            finalizeOutcome(deadline);
            closeContext();
        } finally {
            watchdog.interrupt();
            terminator.terminate(Constants.EXIT_SYSTEM_FAILURE);
        }
    }

    private void finalizeOutcome(long deadline) {
        FinalizationGuard guard = context.getGuard();
        if (!guard.tryClaim()) {
            log.info("终态已由正常路径接管，等待其写入完成");
            try {
                Duration remaining = Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
                if (!guard.awaitRecorded(remaining)) {
                    log.warn("等待正常路径写入超时");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("等待正常路径写入被中断");
            }
            return;
        }

        try {
            RuntimeContext.BoundExecution bound = context.getBound();
            if (bound == null) {
                log.info("尚未绑定执行记录，无需写入终态");
                return;
            }
            recorder.record(bound.executionId(), bound.scheduleId(), ExecutionStatus.ERROR, TERMINATED_MESSAGE, null);
            context.transition(RuntimeState.TERMINATED);
        } catch (Exception e) {
            log.error("终止时写入执行结果失败", e);
        } finally {
            guard.markRecorded();
        }
    }

    private void closeContext() {
        if (contextCloser == null) {
            return;
        }
        try {
            contextCloser.run();
        } catch (Exception e) {
            log.warn("关闭应用上下文失败: {}", e.getMessage(), e);
        }
    }

    private Thread startWatchdog(Duration timeout) {
        Thread watchdog = new Thread(() -> {
            try {
                Thread.sleep(timeout.toMillis());
                log.error("关闭超时，强制终止进程: timeout={}ms", timeout.toMillis());
                terminator.terminate(Constants.EXIT_SYSTEM_FAILURE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "worker-shutdown-watchdog");
        watchdog.setDaemon(true);
        watchdog.start();
        return watchdog;
    }
}

package com.sunny.trigger.worker.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Worker 进程级运行上下文
 * <p>
 * 正常执行路径与终止信号处理器共享：取消令牌、终态守卫、当前绑定的执行记录
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public class RuntimeContext {

    private static final Logger log = LoggerFactory.getLogger(RuntimeContext.class);

    private final CancellationToken token = new CancellationToken();
    private final FinalizationGuard guard = new FinalizationGuard();
    private final AtomicReference<BoundExecution> bound = new AtomicReference<>();
    private final AtomicReference<RuntimeState> state = new AtomicReference<>(RuntimeState.STARTING);

    /**
     * 绑定当前执行记录，此后终止信号会把终态写到这条记录
     */
    public void bind(String executionId, String scheduleId) {
        bound.set(new BoundExecution(executionId, scheduleId));
    }

    public BoundExecution getBound() {
        return bound.get();
    }

    /**
     * 状态迁移，终态之后不再变化
     *
     * @return 是否迁移成功
     */
    public boolean transition(RuntimeState next) {
        RuntimeState current;
        do {
            current = state.get();
            if (current.isTerminal()) {
                log.debug("运行状态已终结，忽略迁移: {} -> {}", current, next);
                return false;
            }
        } while (!state.compareAndSet(current, next));
        log.debug("运行状态迁移: {} -> {}", current, next);
        return true;
    }

    public RuntimeState getState() {
        return state.get();
    }

    public CancellationToken getToken() {
        return token;
    }

    public FinalizationGuard getGuard() {
        return guard;
    }

    /**
     * @param scheduleId 手动执行时为 null
     */
    public record BoundExecution(String executionId, String scheduleId) {
    }
}

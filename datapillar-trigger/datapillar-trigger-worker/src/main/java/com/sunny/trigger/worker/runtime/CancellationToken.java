package com.sunny.trigger.worker.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 取消令牌
 * <p>
 * 只能取消一次；取消后注册的回调立即执行
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            runCallback(callback);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 注册取消回调
     *
     * @return 注销动作，调用方在不再需要时执行
     */
    public Runnable onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get()) {
            runCallback(callback);
        }
        return () -> callbacks.remove(callback);
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("取消回调执行失败: {}", e.getMessage(), e);
        }
    }
}

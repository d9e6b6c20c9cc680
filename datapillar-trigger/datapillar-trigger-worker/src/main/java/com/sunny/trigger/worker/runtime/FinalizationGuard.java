package com.sunny.trigger.worker.runtime;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 终态写入守卫
 * <p>
 * 正常完成路径与终止信号路径竞争同一把守卫，只有 claim 成功的一方写库；
 * 另一方可等待其写完。
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public class FinalizationGuard {

    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private final CountDownLatch recorded = new CountDownLatch(1);

    /**
     * @return true 表示由调用方负责写入终态
     */
    public boolean tryClaim() {
        return claimed.compareAndSet(false, true);
    }

    public boolean isClaimed() {
        return claimed.get();
    }

    /**
     * 持有方写入结束（无论成功与否）后调用
     */
    public void markRecorded() {
        recorded.countDown();
    }

    /**
     * 等待持有方写入结束
     *
     * @return 超时前结束返回 true
     */
    public boolean awaitRecorded(Duration timeout) throws InterruptedException {
        return recorded.await(Math.max(0, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }
}

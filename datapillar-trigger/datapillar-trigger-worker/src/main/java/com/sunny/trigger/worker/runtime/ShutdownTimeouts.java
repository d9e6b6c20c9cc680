package com.sunny.trigger.worker.runtime;

import com.sunny.trigger.core.common.Assert;

import java.time.Duration;

/**
 * 关闭时限
 * <p>
 * 平台在 gracePeriod 后强杀进程，关闭流程必须在 gracePeriod - buffer 内结束
 *
 * @param gracePeriod 平台宽限期
 * @param buffer      预留余量，必须大于 0
 * @author SunnyX6
 * @date 2025-12-16
 */
public record ShutdownTimeouts(Duration gracePeriod, Duration buffer) {

    public static final Duration DEFAULT_GRACE_PERIOD = Duration.ofSeconds(30);
    public static final Duration DEFAULT_BUFFER = Duration.ofSeconds(5);

    public ShutdownTimeouts {
        Assert.notNull(gracePeriod, "宽限期不能为空");
        Assert.notNull(buffer, "预留余量不能为空");
        Assert.isTrue(!buffer.isNegative() && !buffer.isZero(), "预留余量必须大于 0");
        Assert.isTrue(gracePeriod.compareTo(buffer) > 0, "宽限期必须大于预留余量");
    }

    public static ShutdownTimeouts defaults() {
        return new ShutdownTimeouts(DEFAULT_GRACE_PERIOD, DEFAULT_BUFFER);
    }

    /**
     * 关闭流程的截止时长
     */
    public Duration shutdownTimeout() {
        return gracePeriod.minus(buffer);
    }
}

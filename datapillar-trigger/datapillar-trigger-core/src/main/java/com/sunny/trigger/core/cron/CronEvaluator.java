package com.sunny.trigger.core.cron;

import com.sunny.trigger.core.common.Assert;
import com.sunny.trigger.core.common.Constants;
import org.springframework.scheduling.support.CronExpression;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Cron 窗口评估器
 * <p>
 * 触发判定只依赖墙上时间：取不晚于 now 的最近一次触发时间 prev，
 * 满足 0 &lt;= now - prev &lt; window 时触发。window 与 Dispatcher 调用周期一致（1 分钟），
 * 不记录"本分钟是否已触发"。
 * <p>
 * 评估方法不会向外抛出异常，表达式或时区错误通过 {@link CronEvaluation#error()} 返回。
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public class CronEvaluator {

    private final Duration window;
    private final Clock clock;

    public CronEvaluator() {
        this(Constants.DEFAULT_FIRE_WINDOW, Clock.systemUTC());
    }

    public CronEvaluator(Duration window, Clock clock) {
        Assert.notNull(window, "触发窗口不能为空");
        Assert.isTrue(!window.isNegative() && !window.isZero(), "触发窗口必须大于 0");
        this.window = window;
        this.clock = Assert.notNull(clock, "Clock 不能为空");
    }

    public Duration getWindow() {
        return window;
    }

    public boolean shouldTriggerNow(String cronExpr, String timezone, Instant now) {
        return evaluate(cronExpr, timezone, now).shouldFire();
    }

    /**
     * 评估当前窗口
     */
    public CronEvaluation evaluate(String cronExpr, String timezone, Instant now) {
        Assert.notNull(now, "评估时间不能为空");
        if (timezone == null) {
            return CronEvaluation.failed("时区不能为空");
        }
        try {
            ZonedDateTime anchor = now.atZone(ZoneId.of(timezone));
            ZonedDateTime previous = CronUtils.previous(CronUtils.parse(cronExpr), anchor);
            if (previous == null) {
                return CronEvaluation.failed("Cron 表达式 400 年内没有触发时间: " + cronExpr);
            }
            Duration delta = Duration.between(previous.toInstant(), now);
            boolean fire = !delta.isNegative() && delta.compareTo(window) < 0;
            return CronEvaluation.of(fire, previous.toInstant());
        } catch (IllegalArgumentException | DateTimeException e) {
            return CronEvaluation.failed(e.getMessage());
        }
    }

    /**
     * 不晚于 now 的最近一次触发时间
     *
     * @return 无法解析或 400 年内没有触发时返回 null
     */
    public Instant previousOccurrence(String cronExpr, String timezone, Instant now) {
        return evaluate(cronExpr, timezone, now).previous();
    }

    public Instant computeNextRunTime(String cronExpr, String timezone) {
        return computeNextRunTime(cronExpr, timezone, clock.instant());
    }

    /**
     * 计算 from 之后的下一次触发时间
     *
     * @return 严格晚于 from 的触发时间；表达式无法解析或没有后续触发时返回 null
     */
    public Instant computeNextRunTime(String cronExpr, String timezone, Instant from) {
        if (timezone == null || from == null) {
            return null;
        }
        try {
            CronExpression cron = CronUtils.parse(cronExpr);
            ZonedDateTime next = cron.next(from.atZone(ZoneId.of(timezone)));
            return next == null ? null : next.toInstant();
        } catch (IllegalArgumentException | DateTimeException e) {
            return null;
        }
    }
}

package com.sunny.trigger.core.cron;

import com.sunny.trigger.core.common.Assert;
import org.springframework.scheduling.support.CronExpression;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.regex.Pattern;

/**
 * Cron 工具类
 * <p>
 * 基于 Spring CronExpression 实现，支持两种格式：
 * <ul>
 *     <li>5 段：分 时 日 月 周，解析时补秒字段 0</li>
 *     <li>6 段：秒 分 时 日 月 周</li>
 * </ul>
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public final class CronUtils {

    private static final Pattern FIELD_SEPARATOR = Pattern.compile("\\s+");

    /**
     * 向前回溯的上限，400 年内没有触发时间视为表达式无效
     */
    private static final Duration MAX_LOOKBACK = Duration.ofDays(146_097);

    private static final Duration INITIAL_LOOKBACK = Duration.ofMinutes(1);

    private CronUtils() {
    }

    /**
     * 校验 Cron 表达式
     * <p>
     * 先检查字段数，字段数不对时不调用解析器
     *
     * @param cronExpr Cron 表达式
     * @return 校验结果，失败时带第一个错误
     */
    public static CronValidation validate(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) {
            return CronValidation.fail("Cron 表达式不能为空");
        }
        int fieldCount = countFields(cronExpr);
        if (fieldCount != 5 && fieldCount != 6) {
            return CronValidation.fail("Cron 表达式字段数必须为 5 或 6，实际为 " + fieldCount);
        }
        try {
            CronExpression.parse(normalize(cronExpr));
            return CronValidation.ok();
        } catch (IllegalArgumentException e) {
            return CronValidation.fail(e.getMessage());
        }
    }

    /**
     * 解析 Cron 表达式
     *
     * @throws IllegalArgumentException 表达式为空、字段数不对或语法错误
     */
    public static CronExpression parse(String cronExpr) {
        Assert.notBlank(cronExpr, "Cron 表达式不能为空");
        int fieldCount = countFields(cronExpr);
        Assert.isTrue(fieldCount == 5 || fieldCount == 6,
                "Cron 表达式字段数必须为 5 或 6，实际为 " + fieldCount);
        return CronExpression.parse(normalize(cronExpr));
    }

    /**
     * 5 段表达式补秒字段
     */
    static String normalize(String cronExpr) {
        String trimmed = cronExpr.trim();
        return countFields(trimmed) == 5 ? "0 " + trimmed : trimmed;
    }

    static int countFields(String cronExpr) {
        String trimmed = cronExpr.trim();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return FIELD_SEPARATOR.split(trimmed).length;
    }

    /**
     * 计算不晚于 anchor 的最近一次触发时间
     * <p>
     * Spring CronExpression 只能向后计算，这里先倍增回溯找到包含上一次触发的区间，
     * 再按秒二分：找最大的 t 使 next(t) &lt;= anchor，此时 next(t) 就是上一次触发时间。
     *
     * @return 上一次触发时间，400 年内没有则返回 null
     */
    public static ZonedDateTime previous(CronExpression cron, ZonedDateTime anchor) {
        ZonedDateTime lower = null;
        Duration lookback = INITIAL_LOOKBACK;
        while (true) {
            ZonedDateTime from = anchor.minus(lookback);
            ZonedDateTime next = cron.next(from);
            if (next != null && !next.isAfter(anchor)) {
                lower = from;
                break;
            }
            if (lookback.compareTo(MAX_LOOKBACK) >= 0) {
                break;
            }
            lookback = lookback.multipliedBy(2);
            if (lookback.compareTo(MAX_LOOKBACK) > 0) {
                lookback = MAX_LOOKBACK;
            }
        }
        if (lower == null) {
            return null;
        }

        // next(lower + lo) <= anchor 恒成立，next(lower + hi) > anchor 恒成立
        long lo = 0;
        long hi = lookback.getSeconds();
        while (hi - lo > 1) {
            long mid = lo + (hi - lo) / 2;
            ZonedDateTime next = cron.next(lower.plusSeconds(mid));
            if (next != null && !next.isAfter(anchor)) {
                lo = mid;
            } else {
                hi = mid;
            }
        }
        return cron.next(lower.plusSeconds(lo));
    }
}

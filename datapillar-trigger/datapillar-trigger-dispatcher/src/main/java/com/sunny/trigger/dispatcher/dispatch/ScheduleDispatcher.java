package com.sunny.trigger.dispatcher.dispatch;

import com.sunny.trigger.core.cron.CronEvaluation;
import com.sunny.trigger.core.cron.CronEvaluator;
import com.sunny.trigger.core.message.TriggerMessage;
import com.sunny.trigger.core.queue.TriggerQueue;
import com.sunny.trigger.dispatcher.source.ScheduleDefinition;
import com.sunny.trigger.dispatcher.source.ScheduleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * 调度分发器
 * <p>
 * 单轮流程：
 * 1. 拉取全部启用调度（只读，不加锁）
 * 2. 逐个按窗口评估，命中则构造触发消息入队
 * 3. 统计评估数、入队数、跳过数、失败数
 * <p>
 * 单个调度的评估或入队失败只计数，不中断本轮；本轮不重试，错过的窗口不补发。
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@Component
public class ScheduleDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ScheduleDispatcher.class);

    private final ScheduleSource scheduleSource;
    private final CronEvaluator cronEvaluator;
    private final TriggerQueue triggerQueue;

    public ScheduleDispatcher(ScheduleSource scheduleSource, CronEvaluator cronEvaluator, TriggerQueue triggerQueue) {
        this.scheduleSource = scheduleSource;
        this.cronEvaluator = cronEvaluator;
        this.triggerQueue = triggerQueue;
    }

    /**
     * 执行一轮分发
     *
     * @param now 本轮评估时刻，同时作为触发消息的 triggerTime
     * @throws com.sunny.trigger.dispatcher.source.ScheduleSourceException 无法拉取调度
     */
    public DispatchReport dispatch(Instant now) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        log.info("[{}] 开始分发: now={}", runId, now);

        List<ScheduleDefinition> schedules = scheduleSource.fetchEnabled();
        log.info("[{}] 拉取到 {} 个启用调度", runId, schedules.size());

        int evaluated = 0;
        int triggered = 0;
        int skipped = 0;
        int errors = 0;

        for (ScheduleDefinition schedule : schedules) {
            try {
                switch (dispatchOne(runId, schedule, now)) {
                    case TRIGGERED -> {
                        evaluated++;
                        triggered++;
                    }
                    case NOT_DUE -> evaluated++;
                    case SKIPPED -> {
                        evaluated++;
                        skipped++;
                    }
                    default -> {
                    }
                }
            } catch (Exception e) {
                errors++;
                log.error("[{}] 调度处理失败: scheduleId={}, workflowId={}", runId,
                        schedule == null ? null : schedule.id(), schedule == null ? null : schedule.workflowId(), e);
            }
        }

        DispatchReport report = new DispatchReport(runId, evaluated, triggered, skipped, errors);
        log.info("[{}] 分发结束: evaluated={}, triggered={}, skipped={}, errors={}",
                runId, evaluated, triggered, skipped, errors);
        return report;
    }

    /**
     * 单个调度的评估与入队，异常由调用方计入 errors，不影响其余调度
     */
    private Outcome dispatchOne(String runId, ScheduleDefinition schedule, Instant now) {
        if (!schedule.isEnabled()) {
            log.debug("[{}] 调度已停用，跳过: scheduleId={}", runId, schedule.id());
            return Outcome.DISABLED;
        }

        CronEvaluation evaluation = cronEvaluator.evaluate(schedule.cronExpression(), schedule.timezone(), now);
        if (evaluation.hasError()) {
            log.warn("[{}] 调度评估失败，本轮跳过: scheduleId={}, cron={}, timezone={}, error={}",
                    runId, schedule.id(), schedule.cronExpression(), schedule.timezone(), evaluation.error());
            return Outcome.SKIPPED;
        }
        if (!evaluation.shouldFire()) {
            return Outcome.NOT_DUE;
        }

        String messageId = triggerQueue.send(TriggerMessage.schedule(schedule.workflowId(), schedule.id(), now));
        log.info("[{}] 已入队: scheduleId={}, workflowId={}, previous={}, messageId={}",
                runId, schedule.id(), schedule.workflowId(), evaluation.previous(), messageId);
        return Outcome.TRIGGERED;
    }

    private enum Outcome {
        DISABLED,
        SKIPPED,
        NOT_DUE,
        TRIGGERED
    }
}

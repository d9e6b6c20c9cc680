package com.sunny.trigger.dispatcher.dispatch;

import com.sunny.trigger.core.common.Constants;

/**
 * 单轮分发统计
 *
 * @param runId     本轮标识（日志关联用）
 * @param evaluated 参与评估的调度数
 * @param triggered 成功入队数
 * @param skipped   评估出错而跳过的调度数
 * @param errors    入队失败数
 * @author SunnyX6
 * @date 2025-12-15
 */
public record DispatchReport(String runId, int evaluated, int triggered, int skipped, int errors) {

    /**
     * 有入队失败时返回非零退出码，由外部调度感知
     */
    public int exitCode() {
        return errors > 0 ? Constants.EXIT_SYSTEM_FAILURE : Constants.EXIT_RECORDED;
    }
}

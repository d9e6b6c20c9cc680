package com.sunny.trigger.worker.runtime;

import com.sunny.trigger.core.enums.ExecutionStatus;
import com.sunny.trigger.core.enums.ScheduleRunStatus;
import com.sunny.trigger.core.util.ThrowableUtil;
import com.sunny.trigger.store.service.WorkflowExecutionService;
import com.sunny.trigger.store.service.WorkflowScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 终态写入
 * <p>
 * 先写执行记录（completed_at 为空才写），写入成功且有调度 ID 时再更新调度运行结果。
 * 数据库异常向上抛出。
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public class OutcomeRecorder {

    private static final Logger log = LoggerFactory.getLogger(OutcomeRecorder.class);

    private final WorkflowExecutionService executionService;
    private final WorkflowScheduleService scheduleService;

    public OutcomeRecorder(WorkflowExecutionService executionService, WorkflowScheduleService scheduleService) {
        this.executionService = executionService;
        this.scheduleService = scheduleService;
    }

    /**
     * @return 本次是否写入了执行记录；已被其他进程写入时返回 false
     */
    public boolean record(String executionId, String scheduleId, ExecutionStatus status, String error, String output) {
        String message = ThrowableUtil.truncate(error);
        boolean written = executionService.complete(executionId, status, message, output);
        if (!written) {
            log.info("执行记录已有终态，跳过写入: executionId={}", executionId);
            return false;
        }
        log.info("执行结果已记录: executionId={}, status={}", executionId, status.getCode());

        if (scheduleId != null) {
            boolean updated = scheduleService.updateAfterRun(scheduleId, ScheduleRunStatus.fromExecution(status), message);
            if (!updated) {
                log.warn("调度不存在，未更新运行结果: scheduleId={}", scheduleId);
            }
        }
        return true;
    }
}

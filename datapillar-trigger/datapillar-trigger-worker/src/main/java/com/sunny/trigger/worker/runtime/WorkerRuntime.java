package com.sunny.trigger.worker.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sunny.trigger.core.common.Assert;
import com.sunny.trigger.core.common.Constants;
import com.sunny.trigger.core.enums.ExecutionStatus;
import com.sunny.trigger.core.message.MalformedTriggerMessageException;
import com.sunny.trigger.core.message.TriggerMessage;
import com.sunny.trigger.core.message.TriggerMessageCodec;
import com.sunny.trigger.core.queue.ReceivedTrigger;
import com.sunny.trigger.core.queue.TriggerQueue;
import com.sunny.trigger.core.util.ThrowableUtil;
import com.sunny.trigger.store.entity.WorkflowExecution;
import com.sunny.trigger.store.entity.WorkflowSchedule;
import com.sunny.trigger.store.model.TriggerRegistration;
import com.sunny.trigger.store.service.WorkflowExecutionService;
import com.sunny.trigger.store.service.WorkflowScheduleService;
import com.sunny.trigger.worker.config.WorkerProperties;
import com.sunny.trigger.worker.executor.WorkflowCancelledException;
import com.sunny.trigger.worker.executor.WorkflowExecutionRequest;
import com.sunny.trigger.worker.executor.WorkflowExecutionResult;
import com.sunny.trigger.worker.executor.WorkflowExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Worker 运行时：一个进程处理一次执行
 * <p>
 * 退出码：
 * <ul>
 *     <li>0：结果已记录（含业务失败、重复投递、无需处理）</li>
 *     <li>1：被终止信号中断、致命错误未能记录、数据库不可达</li>
 * </ul>
 *
 * @author SunnyX6
 * @date 2025-12-16
 */
public class WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    private final WorkerProperties properties;
    private final RuntimeContext context;
    private final WorkflowExecutionService executionService;
    private final WorkflowScheduleService scheduleService;
    private final OutcomeRecorder recorder;
    private final WorkflowExecutor executor;
    private final TriggerQueue triggerQueue;
    private final TriggerMessageCodec codec;
    private final ObjectMapper objectMapper;

    public WorkerRuntime(WorkerProperties properties,
                         RuntimeContext context,
                         WorkflowExecutionService executionService,
                         WorkflowScheduleService scheduleService,
                         OutcomeRecorder recorder,
                         WorkflowExecutor executor,
                         TriggerQueue triggerQueue,
                         TriggerMessageCodec codec,
                         ObjectMapper objectMapper) {
        this.properties = properties;
        this.context = context;
        this.executionService = executionService;
        this.scheduleService = scheduleService;
        this.recorder = recorder;
        this.executor = executor;
        this.triggerQueue = triggerQueue;
        this.codec = codec;
        this.objectMapper = objectMapper;
    }

    /**
     * 执行并返回进程退出码
     */
    public int run() {
        WorkerMode mode = properties.getMode();
        log.info("Worker 启动: mode={}", mode);
        try {
            if (mode == WorkerMode.QUEUE) {
                return runQueue();
            }
            return runExecution();
        } catch (WorkflowCancelledException e) {
            log.warn("执行被终止信号取消: {}", e.getMessage());
            return Constants.EXIT_SYSTEM_FAILURE;
        } catch (Exception e) {
            log.error("Worker 致命错误", e);
            return recordFatal(e);
        }
    }

    /**
     * 已绑定执行记录时尝试把致命错误写入终态，写入成功以 0 退出
     */
    private int recordFatal(Exception e) {
        RuntimeContext.BoundExecution bound = context.getBound();
        if (bound == null) {
            return Constants.EXIT_SYSTEM_FAILURE;
        }
        return finish(bound.executionId(), bound.scheduleId(), ExecutionStatus.ERROR, ThrowableUtil.rootMessage(e), null);
    }

    // ==================== execution 模式 ====================

    private int runExecution() {
        String workflowId = Assert.notBlank(properties.getWorkflowId(), "WORKFLOW_ID 不能为空");
        String executionId = Assert.notBlank(properties.getExecutionId(), "EXECUTION_ID 不能为空");

        WorkflowExecution execution = executionService.getById(executionId);
        if (execution == null) {
            log.warn("执行记录不存在，无需处理: executionId={}", executionId);
            return Constants.EXIT_RECORDED;
        }
        if (execution.isCompleted()) {
            log.info("执行记录已有终态，视为重复投递: executionId={}, status={}",
                    executionId, execution.getStatus() == null ? null : execution.getStatus().getCode());
            return Constants.EXIT_RECORDED;
        }
        String scheduleId = blankToNull(properties.getScheduleId());
        if (scheduleId == null) {
            scheduleId = execution.getScheduleId();
        }
        context.bind(executionId, scheduleId);

        if (!workflowId.equals(execution.getWorkflowId())) {
            String error = "执行记录不属于该工作流: executionId=" + executionId + ", workflowId=" + workflowId;
            log.warn(error);
            return finish(executionId, scheduleId, ExecutionStatus.ERROR, error, null);
        }

        if (!executionService.markRunning(executionId)) {
            log.info("执行记录已被其他进程结束: executionId={}", executionId);
            return Constants.EXIT_RECORDED;
        }

        JsonNode input;
        try {
            input = parseInput(properties.getInput());
        } catch (IllegalArgumentException e) {
            log.warn("工作流输入无效: executionId={}, error={}", executionId, e.getMessage());
            return finish(executionId, scheduleId, ExecutionStatus.ERROR, e.getMessage(), null);
        }
        return executeAndRecord(workflowId, executionId, scheduleId, input);
    }

    // ==================== queue 模式 ====================

    private int runQueue() {
        List<ReceivedTrigger> messages = triggerQueue.receive(1);
        if (messages.isEmpty()) {
            log.info("队列中没有触发消息");
            return Constants.EXIT_RECORDED;
        }
        ReceivedTrigger received = messages.get(0);

        TriggerMessage message;
        try {
            message = codec.decode(received.body());
        } catch (MalformedTriggerMessageException e) {
            log.warn("触发消息格式错误，转入死信: messageId={}, error={}", received.messageId(), e.getMessage());
            triggerQueue.deadLetter(received, e.getMessage());
            return Constants.EXIT_RECORDED;
        }

        WorkflowSchedule schedule = scheduleService.getById(message.scheduleId());
        if (schedule == null || !schedule.isEnabled()) {
            log.info("调度不存在或已停用，丢弃消息: scheduleId={}, messageId={}",
                    message.scheduleId(), received.messageId());
            triggerQueue.acknowledge(received);
            return Constants.EXIT_RECORDED;
        }

        ObjectNode input = scheduledInput(message);
        TriggerRegistration registration = executionService.createFromTrigger(message, input.toString());
        if (registration.duplicate()) {
            log.info("重复触发，丢弃消息: triggerKey={}, executionId={}",
                    message.triggerKey(), registration.execution().getId());
            triggerQueue.acknowledge(received);
            return Constants.EXIT_RECORDED;
        }

        String executionId = registration.execution().getId();
        context.bind(executionId, message.scheduleId());
        log.info("已登记执行记录: executionId={}, workflowId={}, scheduleId={}, triggerTime={}",
                executionId, message.workflowId(), message.scheduleId(), message.triggerTime());

        int exitCode = executeAndRecord(message.workflowId(), executionId, message.scheduleId(), input);
        if (exitCode == Constants.EXIT_RECORDED) {
            acknowledgeQuietly(received);
        }
        return exitCode;
    }

    private ObjectNode scheduledInput(TriggerMessage message) {
        ObjectNode input = objectMapper.createObjectNode();
        input.put("triggerType", message.triggerType().getCode());
        input.put("scheduleId", message.scheduleId());
        input.put("triggerTime", message.triggerTime().toString());
        return input;
    }

    /**
     * 结果已落库，确认失败只会导致重复投递，由幂等键丢弃
     */
    private void acknowledgeQuietly(ReceivedTrigger received) {
        try {
            triggerQueue.acknowledge(received);
        } catch (RuntimeException e) {
            log.warn("确认消息失败，等待重新投递后按重复丢弃: messageId={}, error={}",
                    received.messageId(), e.getMessage());
        }
    }

    // ==================== 执行与记录 ====================

    private int executeAndRecord(String workflowId, String executionId, String scheduleId, JsonNode input) {
        context.transition(RuntimeState.RUNNING);

        WorkflowExecutionResult result;
        try {
            result = executor.execute(new WorkflowExecutionRequest(workflowId, executionId, input), context.getToken());
        } catch (WorkflowCancelledException e) {
            throw e;
        } catch (Exception e) {
            log.error("工作流执行异常: executionId={}", executionId, e);
            return finish(executionId, scheduleId, ExecutionStatus.ERROR, ThrowableUtil.rootMessage(e), null);
        }

        if (result.success()) {
            return finish(executionId, scheduleId, ExecutionStatus.SUCCESS, null, toText(result.output()));
        }
        String error = result.error() == null ? "工作流执行失败" : result.error();
        log.info("工作流业务失败: executionId={}, error={}", executionId, error);
        return finish(executionId, scheduleId, ExecutionStatus.ERROR, error, toText(result.output()));
    }

    /**
     * 抢占终态守卫后写入；守卫已被终止信号处理器占用时不写
     */
    private int finish(String executionId, String scheduleId, ExecutionStatus status, String error, String output) {
        FinalizationGuard guard = context.getGuard();
        if (!guard.tryClaim()) {
            log.warn("终态已由终止信号处理器接管: executionId={}", executionId);
            return Constants.EXIT_SYSTEM_FAILURE;
        }
        try {
            recorder.record(executionId, scheduleId, status, error, output);
            context.transition(status == ExecutionStatus.SUCCESS ? RuntimeState.SUCCESS : RuntimeState.ERROR);
            return Constants.EXIT_RECORDED;
        } catch (Exception e) {
            log.error("记录执行结果失败: executionId={}", executionId, e);
            return Constants.EXIT_SYSTEM_FAILURE;
        } finally {
            guard.markRecorded();
        }
    }

    private JsonNode parseInput(String input) {
        if (input == null || input.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(input);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("WORKFLOW_INPUT 不是合法 JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String toText(JsonNode node) {
        return node == null || node.isNull() ? null : node.toString();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

package com.sunny.trigger.worker.runtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sunny.trigger.core.enums.ExecutionStatus;
import com.sunny.trigger.core.enums.ScheduleRunStatus;
import com.sunny.trigger.core.enums.TriggerType;
import com.sunny.trigger.core.message.TriggerMessageCodec;
import com.sunny.trigger.core.queue.TriggerQueue;
import com.sunny.trigger.store.entity.WorkflowExecution;
import com.sunny.trigger.store.service.WorkflowExecutionService;
import com.sunny.trigger.store.service.WorkflowScheduleService;
import com.sunny.trigger.worker.config.WorkerProperties;
import com.sunny.trigger.worker.executor.WorkflowCancelledException;
import com.sunny.trigger.worker.executor.WorkflowExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

/**
 * 工作流调用进行中收到终止信号：正常路径与关闭钩子在两个线程上竞争收尾
 */
@ExtendWith(MockitoExtension.class)
class SignalDuringExecutionTest {

    @Mock
    private WorkflowExecutionService executionService;
    @Mock
    private WorkflowScheduleService scheduleService;
    @Mock
    private TriggerQueue triggerQueue;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicBoolean contextClosed = new AtomicBoolean(false);
    private final AtomicInteger writes = new AtomicInteger();
    private final List<Integer> terminateCodes = new CopyOnWriteArrayList<>();
    private final CountDownLatch executorEntered = new CountDownLatch(1);

    private RuntimeContext context;
    private WorkerRuntime runtime;
    private ShutdownHandler handler;

    @BeforeEach
    void setUp() {
        WorkerProperties properties = new WorkerProperties();
        properties.setMode(WorkerMode.EXECUTION);
        properties.setWorkflowId("wf-1");
        properties.setExecutionId("exec-1");
        properties.setScheduleId("sch-1");

        context = new RuntimeContext();
        OutcomeRecorder recorder = new OutcomeRecorder(executionService, scheduleService);
        runtime = new WorkerRuntime(properties, context, executionService, scheduleService, recorder,
                blockingExecutor(), triggerQueue, new TriggerMessageCodec(objectMapper), objectMapper);
        handler = new ShutdownHandler(context, recorder, ShutdownTimeouts.defaults(), terminateCodes::add,
                () -> contextClosed.set(true));
    }

    @Test
    void signal_shouldRecordTerminationBeforeContextIsClosed() throws Exception {
        WorkflowExecution execution = new WorkflowExecution();
        execution.setId("exec-1");
        execution.setWorkflowId("wf-1");
        execution.setScheduleId("sch-1");
        execution.setTriggerType(TriggerType.SCHEDULE);
        execution.setStatus(ExecutionStatus.PENDING);
        when(executionService.getById("exec-1")).thenReturn(execution);
        when(executionService.markRunning("exec-1")).thenReturn(true);
        when(executionService.complete("exec-1", ExecutionStatus.ERROR,
                ShutdownHandler.TERMINATED_MESSAGE, null)).thenAnswer(invocation -> {
            Thread.sleep(50);
            if (contextClosed.get()) {
                throw new IllegalStateException("HikariDataSource has been closed");
            }
            writes.incrementAndGet();
            return true;
        });
        when(scheduleService.updateAfterRun("sch-1", ScheduleRunStatus.ERROR,
                ShutdownHandler.TERMINATED_MESSAGE)).thenReturn(true);

        AtomicInteger exitCode = new AtomicInteger(-1);
        AtomicBoolean mainPathClosed = new AtomicBoolean(false);
        Thread mainPath = new Thread(() -> {
            exitCode.set(runtime.run());
            if (handler.disarm()) {
                mainPathClosed.set(true);
                contextClosed.set(true);
            }
        }, "worker-main");
        mainPath.start();
        assertTrue(executorEntered.await(2, TimeUnit.SECONDS));

        Thread hook = new Thread(handler, "worker-shutdown");
        hook.start();
        mainPath.join(5000);
        hook.join(5000);

        assertEquals(1, exitCode.get());
        assertFalse(mainPathClosed.get(), "钩子运行中，正常路径不应关闭上下文");
        assertEquals(1, writes.get());
        assertEquals(RuntimeState.TERMINATED, context.getState());
        assertTrue(contextClosed.get());
        assertEquals(List.of(1), terminateCodes);
    }

    @Test
    void disarm_shouldWinOnlyOnceBeforeHookStarts() {
        assertTrue(handler.disarm());
        assertFalse(handler.disarm());

        handler.run();

        assertFalse(context.getToken().isCancelled());
        assertTrue(terminateCodes.isEmpty());
    }

    private WorkflowExecutor blockingExecutor() {
        return (request, token) -> {
            CountDownLatch cancelled = new CountDownLatch(1);
            token.onCancel(cancelled::countDown);
            executorEntered.countDown();
            try {
                cancelled.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new WorkflowCancelledException("工作流调用已取消");
        };
    }
}

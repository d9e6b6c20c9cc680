package com.sunny.trigger.dispatcher.dispatch;

import com.sunny.trigger.dispatcher.source.ScheduleSourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DispatchRunnerTest {

    private static final Instant NOW = Instant.parse("2025-03-10T10:00:30Z");

    @Mock
    private ScheduleDispatcher dispatcher;

    @Test
    void run_shouldMapEnqueueErrorsToNonZeroExit() {
        when(dispatcher.dispatch(NOW)).thenReturn(new DispatchReport("abcd1234", 5, 3, 0, 2));
        DispatchRunner runner = new DispatchRunner(dispatcher, Clock.fixed(NOW, ZoneOffset.UTC));

        runner.run();

        assertEquals(1, runner.getExitCode());
    }

    @Test
    void run_cleanCycleShouldExitZero() {
        when(dispatcher.dispatch(NOW)).thenReturn(new DispatchReport("abcd1234", 5, 3, 1, 0));
        DispatchRunner runner = new DispatchRunner(dispatcher, Clock.fixed(NOW, ZoneOffset.UTC));

        runner.run();

        assertEquals(0, runner.getExitCode());
    }

    @Test
    void run_fatalErrorShouldExitOne() {
        when(dispatcher.dispatch(NOW)).thenThrow(new ScheduleSourceException("拉取调度失败: Connection refused"));
        DispatchRunner runner = new DispatchRunner(dispatcher, Clock.fixed(NOW, ZoneOffset.UTC));

        runner.run();

        assertEquals(1, runner.getExitCode());
    }
}

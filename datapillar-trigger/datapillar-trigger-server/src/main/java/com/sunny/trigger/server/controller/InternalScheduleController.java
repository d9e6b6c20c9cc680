package com.sunny.trigger.server.controller;

import com.sunny.trigger.core.enums.ScheduleRunStatus;
import com.sunny.trigger.server.common.ApiResponse;
import com.sunny.trigger.server.common.ParamValidator;
import com.sunny.trigger.server.dto.ScheduleRunReport;
import com.sunny.trigger.server.dto.ScheduleSummary;
import com.sunny.trigger.store.entity.WorkflowSchedule;
import com.sunny.trigger.store.exception.NotFoundException;
import com.sunny.trigger.store.service.WorkflowScheduleService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 内部调度接口
 * <p>
 * 仅供 Dispatcher / Worker 调用，由 ServiceKeyFilter 校验服务密钥
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@RestController
@RequestMapping("/api/internal/schedules")
public class InternalScheduleController {

    private final WorkflowScheduleService scheduleService;

    public InternalScheduleController(WorkflowScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    /**
     * 全部启用的调度
     */
    @GetMapping
    public ApiResponse<List<ScheduleSummary>> listEnabled() {
        List<ScheduleSummary> schedules = scheduleService.listEnabled().stream()
                .map(ScheduleSummary::from)
                .toList();
        return ApiResponse.ok(schedules);
    }

    @GetMapping("/{scheduleId}")
    public ApiResponse<WorkflowSchedule> get(@PathVariable String scheduleId) {
        WorkflowSchedule schedule = scheduleService.getById(scheduleId);
        if (schedule == null) {
            throw new NotFoundException("调度不存在: " + scheduleId);
        }
        return ApiResponse.ok(schedule);
    }

    /**
     * 回写运行结果
     */
    @PatchMapping("/{scheduleId}")
    public ApiResponse<Void> reportRun(@PathVariable String scheduleId, @RequestBody ScheduleRunReport report) {
        ParamValidator.requireNotNull(report, "请求体");
        ParamValidator.requireNotBlank(report.getStatus(), "status");
        ScheduleRunStatus status = ScheduleRunStatus.of(report.getStatus());
        if (!scheduleService.updateAfterRun(scheduleId, status, report.getError())) {
            throw new NotFoundException("调度不存在: " + scheduleId);
        }
        return ApiResponse.ok();
    }
}

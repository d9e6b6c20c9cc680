package com.sunny.trigger.server.controller;

import com.sunny.trigger.server.common.ApiResponse;
import com.sunny.trigger.server.common.ParamValidator;
import com.sunny.trigger.store.entity.WorkflowSchedule;
import com.sunny.trigger.store.exception.NotFoundException;
import com.sunny.trigger.store.model.SyncResult;
import com.sunny.trigger.store.model.TriggerConfig;
import com.sunny.trigger.store.service.WorkflowScheduleService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 工作流调度配置
 * <p>
 * 工作流保存时同步触发器配置，Cron / 时区在这里校验，不合法的配置不会落库
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
@RestController
@RequestMapping("/api/workflows/{workflowId}/schedule")
public class WorkflowScheduleController {

    private final WorkflowScheduleService scheduleService;

    public WorkflowScheduleController(WorkflowScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @PutMapping
    public ApiResponse<SyncResult> sync(@PathVariable String workflowId, @RequestBody TriggerConfig config) {
        ParamValidator.requireNotNull(config, "触发器配置");
        return ApiResponse.ok(scheduleService.syncSchedule(workflowId, config));
    }

    @GetMapping
    public ApiResponse<WorkflowSchedule> get(@PathVariable String workflowId) {
        WorkflowSchedule schedule = scheduleService.getByWorkflowId(workflowId);
        if (schedule == null) {
            throw new NotFoundException("工作流没有调度: " + workflowId);
        }
        return ApiResponse.ok(schedule);
    }

    @PostMapping("/enable")
    public ApiResponse<WorkflowSchedule> enable(@PathVariable String workflowId) {
        return ApiResponse.ok(scheduleService.setEnabled(workflowId, true));
    }

    @PostMapping("/disable")
    public ApiResponse<WorkflowSchedule> disable(@PathVariable String workflowId) {
        return ApiResponse.ok(scheduleService.setEnabled(workflowId, false));
    }
}

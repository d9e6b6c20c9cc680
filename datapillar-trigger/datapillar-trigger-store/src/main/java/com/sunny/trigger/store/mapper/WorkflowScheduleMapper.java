package com.sunny.trigger.store.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.trigger.core.enums.ScheduleRunStatus;
import com.sunny.trigger.store.entity.WorkflowSchedule;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

/**
 * 工作流调度 Mapper
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@Mapper
public interface WorkflowScheduleMapper extends BaseMapper<WorkflowSchedule> {

    WorkflowSchedule selectByWorkflowId(@Param("workflowId") String workflowId);

    /**
     * 查询全部启用的调度（走 idx_workflow_schedule_enabled）
     */
    List<WorkflowSchedule> selectEnabled();

    int deleteByWorkflowId(@Param("workflowId") String workflowId);

    /**
     * 更新 Cron 配置，不修改 enabled 和运行结果
     */
    int updateDefinition(@Param("id") String id,
                         @Param("cronExpression") String cronExpression,
                         @Param("timezone") String timezone,
                         @Param("nextRunAt") Instant nextRunAt,
                         @Param("updatedAt") Instant updatedAt);

    int updateEnabled(@Param("workflowId") String workflowId,
                      @Param("enabled") boolean enabled,
                      @Param("nextRunAt") Instant nextRunAt,
                      @Param("updatedAt") Instant updatedAt);

    /**
     * 写入运行结果
     * <p>
     * run_count 在 SQL 内自增，success 为 false 时不变
     */
    int updateRunResult(@Param("id") String id,
                        @Param("lastStatus") ScheduleRunStatus lastStatus,
                        @Param("lastError") String lastError,
                        @Param("lastRunAt") Instant lastRunAt,
                        @Param("nextRunAt") Instant nextRunAt,
                        @Param("success") boolean success);
}

package com.sunny.trigger.store.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.sunny.trigger.core.enums.ExecutionStatus;
import com.sunny.trigger.store.entity.WorkflowExecution;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.Instant;
import java.util.List;

/**
 * 工作流执行记录 Mapper
 * <p>
 * 所有状态更新都带 completed_at IS NULL 条件，已结束的记录不会被覆盖
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
@Mapper
public interface WorkflowExecutionMapper extends BaseMapper<WorkflowExecution> {

    WorkflowExecution selectByTriggerKey(@Param("triggerKey") String triggerKey);

    List<WorkflowExecution> selectByWorkflowId(@Param("workflowId") String workflowId,
                                               @Param("limit") int limit);

    /**
     * pending → running，已是 running 时保留原 started_at
     *
     * @return 影响行数，0 表示记录不存在或已结束
     */
    int markRunning(@Param("id") String id, @Param("startedAt") Instant startedAt);

    /**
     * 写入终态
     *
     * @return 影响行数，0 表示记录不存在或已被其他路径写入终态
     */
    int complete(@Param("id") String id,
                 @Param("status") ExecutionStatus status,
                 @Param("error") String error,
                 @Param("output") String output,
                 @Param("completedAt") Instant completedAt,
                 @Param("durationMs") Long durationMs);
}

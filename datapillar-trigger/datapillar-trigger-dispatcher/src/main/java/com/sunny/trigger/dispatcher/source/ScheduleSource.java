package com.sunny.trigger.dispatcher.source;

import java.util.List;

/**
 * 启用调度的来源
 *
 * @author SunnyX6
 * @date 2025-12-15
 */
public interface ScheduleSource {

    /**
     * 拉取全部启用的调度
     *
     * @throws ScheduleSourceException 来源不可用或响应无法解析
     */
    List<ScheduleDefinition> fetchEnabled();
}

package org.csits.qjob.server.dto;

import java.util.Map;
import lombok.Data;
import org.csits.qjob.dao.ScheduleType;

/**
 * 部分更新定时任务，字段为 null 表示不修改。
 */
@Data
public class JobUpdateRequest {

    private String name;
    private ScheduleType scheduleType;
    private String cronExpression;
    private Integer intervalSeconds;
    private Boolean active;
    private Map<String, Object> overrideConfig;
}

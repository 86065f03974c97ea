package org.csits.qjob.server.dto;

import java.util.Map;
import lombok.Data;
import org.csits.qjob.dao.ScheduleType;

/**
 * 创建定时任务的请求。
 */
@Data
public class JobCreateRequest {

    private String name;
    private Long templateId;
    private ScheduleType scheduleType = ScheduleType.CRON;
    private String cronExpression;
    private Integer intervalSeconds;
    private Boolean active = Boolean.TRUE;
    private Map<String, Object> overrideConfig;
}

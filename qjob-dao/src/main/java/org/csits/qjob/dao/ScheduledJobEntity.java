package org.csits.qjob.dao;

import java.time.LocalDateTime;
import java.util.Map;
import lombok.Data;

/**
 * 定时任务实体，对应 scheduled_jobs。
 */
@Data
public class ScheduledJobEntity {

    private Long id;
    private String name;
    private Long templateId;
    private ScheduleType scheduleType = ScheduleType.CRON;
    /** 五段式 crontab，仅 scheduleType=CRON 时使用 */
    private String cronExpression;
    /** 间隔秒数，仅 scheduleType=INTERVAL 时使用 */
    private Integer intervalSeconds;
    private boolean active = true;
    /** 仅供参考，可能滞后于调度器实际状态 */
    private LocalDateTime nextRunTime;
    /** 覆盖配置，按 key 覆盖模板默认配置（仅一层） */
    private Map<String, Object> overrideConfig;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}

package org.csits.qjob.server.trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import lombok.extern.slf4j.Slf4j;
import org.csits.qjob.dao.ScheduleType;
import org.csits.qjob.dao.ScheduledJobEntity;
import org.csits.qjob.server.exception.ScheduleConfigException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

/**
 * 根据定时任务的调度类型与配置构建触发器。
 *
 * cron 采用标准五段 crontab；未配置 qjob.scheduler.zone 时使用主机默认时区。
 */
@Slf4j
@Component
public class TriggerBuilder {

    private final Clock clock;
    private final ZoneId zone;

    public TriggerBuilder(Clock clock, @Value("${qjob.scheduler.zone:}") String zoneId) {
        this.clock = clock;
        this.zone = (zoneId == null || zoneId.trim().isEmpty()) ? ZoneId.systemDefault() : ZoneId.of(zoneId.trim());
    }

    public JobTrigger build(ScheduledJobEntity job) {
        ScheduleType type = job.getScheduleType();
        if (type == null) {
            throw new ScheduleConfigException("未指定调度类型: jobId=" + job.getId());
        }
        switch (type) {
            case CRON:
                return cron(job.getCronExpression());
            case INTERVAL:
                return interval(job.getIntervalSeconds());
            default:
                throw new ScheduleConfigException("不支持的调度类型: " + type);
        }
    }

    public JobTrigger cron(String expression) {
        if (expression == null || expression.trim().isEmpty()) {
            throw new ScheduleConfigException("cron 调度缺少 cron_expression");
        }
        String normalized = expression.trim();
        String[] fields = normalized.split("\\s+");
        if (fields.length != 5) {
            throw new ScheduleConfigException("cron 表达式必须为 5 段（分 时 日 月 周）: " + expression);
        }
        try {
            // Spring 的表达式带秒字段
            CronExpression parsed = CronExpression.parse("0 " + String.join(" ", fields));
            return new CronJobTrigger(normalized, parsed, zone);
        } catch (IllegalArgumentException e) {
            throw new ScheduleConfigException("cron 表达式非法: " + expression + ", " + e.getMessage(), e);
        }
    }

    public JobTrigger interval(Integer intervalSeconds) {
        if (intervalSeconds == null) {
            throw new ScheduleConfigException("interval 调度缺少 interval_seconds");
        }
        if (intervalSeconds <= 0) {
            throw new ScheduleConfigException("interval_seconds 必须大于 0: " + intervalSeconds);
        }
        return new IntervalJobTrigger(clock.instant(), Duration.ofSeconds(intervalSeconds));
    }

    public ZoneId getZone() {
        return zone;
    }
}

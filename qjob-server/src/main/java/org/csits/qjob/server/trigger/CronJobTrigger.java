package org.csits.qjob.server.trigger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import org.springframework.scheduling.support.CronExpression;

/**
 * 五段 crontab 表达式触发器（分 时 日 月 周），按指定时区计算。
 */
public class CronJobTrigger implements JobTrigger {

    private final String expression;
    private final CronExpression cron;
    private final ZoneId zone;

    CronJobTrigger(String expression, CronExpression cron, ZoneId zone) {
        this.expression = expression;
        this.cron = cron;
        this.zone = zone;
    }

    @Override
    public Instant nextFireTime(Instant after) {
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(after, zone));
        return next != null ? next.toInstant() : null;
    }

    @Override
    public String describe() {
        return "cron[" + expression + "] " + zone;
    }
}

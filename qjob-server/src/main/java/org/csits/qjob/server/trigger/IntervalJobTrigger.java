package org.csits.qjob.server.trigger;

import java.time.Duration;
import java.time.Instant;

/**
 * 固定间隔触发器。触发时刻落在 anchor + k * period 上，错过的周期直接跳过。
 */
public class IntervalJobTrigger implements JobTrigger {

    private final Instant anchor;
    private final Duration period;

    IntervalJobTrigger(Instant anchor, Duration period) {
        this.anchor = anchor;
        this.period = period;
    }

    @Override
    public Instant nextFireTime(Instant after) {
        if (after.isBefore(anchor)) {
            return anchor.plus(period);
        }
        long periodMillis = period.toMillis();
        long elapsed = Duration.between(anchor, after).toMillis();
        long periods = elapsed / periodMillis + 1;
        return anchor.plusMillis(periods * periodMillis);
    }

    public Duration getPeriod() {
        return period;
    }

    @Override
    public String describe() {
        return "interval[" + period.getSeconds() + "s]";
    }
}

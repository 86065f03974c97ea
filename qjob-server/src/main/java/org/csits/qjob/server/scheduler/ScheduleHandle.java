package org.csits.qjob.server.scheduler;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import org.csits.qjob.server.trigger.JobTrigger;

/**
 * 运行时中一个任务的调度句柄，只持有 jobId，配置在每次执行时从库中读取。
 */
class ScheduleHandle {

    private final Long jobId;
    private final JobTrigger trigger;
    private final FiringGate gate;
    private volatile Instant nextFireTime;
    private volatile ScheduledFuture<?> future;
    private volatile boolean cancelled;

    ScheduleHandle(Long jobId, JobTrigger trigger, FiringGate gate) {
        this.jobId = jobId;
        this.trigger = trigger;
        this.gate = gate;
    }

    Long getJobId() {
        return jobId;
    }

    JobTrigger getTrigger() {
        return trigger;
    }

    FiringGate getGate() {
        return gate;
    }

    Instant getNextFireTime() {
        return nextFireTime;
    }

    void setNextFireTime(Instant nextFireTime) {
        this.nextFireTime = nextFireTime;
    }

    void setFuture(ScheduledFuture<?> future) {
        this.future = future;
    }

    boolean isCancelled() {
        return cancelled;
    }

    void cancel() {
        cancelled = true;
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
    }
}

package org.csits.qjob.server.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个任务的调度执行闸门：同一时刻最多一次调度执行，执行期间到期的触发合并为一次待执行。
 *
 * 闸门按 jobId 由调度器保存，任务停用后重新启用仍沿用同一闸门，直到闸门空闲且任务不再被调度时才丢弃。
 * 占用与释放均在调度器的 lock 下进行。
 */
class FiringGate {

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean pending = new AtomicBoolean(false);

    boolean tryAcquire() {
        return running.compareAndSet(false, true);
    }

    void release() {
        running.set(false);
    }

    boolean isRunning() {
        return running.get();
    }

    void markPending() {
        pending.set(true);
    }

    void clearPending() {
        pending.set(false);
    }

    boolean isPending() {
        return pending.get();
    }
}

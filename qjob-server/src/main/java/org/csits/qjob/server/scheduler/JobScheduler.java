package org.csits.qjob.server.scheduler;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.csits.qjob.dao.ScheduledJobEntity;
import org.csits.qjob.dao.ScheduledJobRepository;
import org.csits.qjob.server.exception.ScheduleConfigException;
import org.csits.qjob.server.service.ExecutionCoordinator;
import org.csits.qjob.server.trigger.JobTrigger;
import org.csits.qjob.server.trigger.TriggerBuilder;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 调度运行时：单个计时线程计算到期时刻，到期的执行交给固定大小的工作线程池。
 *
 * 规则：
 * - 库中的定时任务是唯一数据源，内存中的句柄只是缓存，启动时及每次任务变更后重新同步；
 * - 同一任务同一时刻最多一次调度执行，执行期间错过的触发合并为一次，在当前执行结束后立即补跑；
 * - 手动触发不受上述限制；
 * - 执行异常不会中断调度。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobScheduler {

    private final ScheduledJobRepository scheduledJobRepository;
    private final TriggerBuilder triggerBuilder;
    private final ExecutionCoordinator executionCoordinator;
    private final Clock clock;

    private final Map<Long, ScheduleHandle> handles = new ConcurrentHashMap<>();
    // 闸门按 jobId 保存，生命周期长于句柄，执行中的闸门在任务移除后仍保留；由 lock 保护
    private final Map<Long, FiringGate> gates = new HashMap<>();
    private final Object lock = new Object();

    @Value("${qjob.scheduler.worker-threads:10}")
    private int workerThreads = 10;

    @Value("${qjob.scheduler.shutdown-wait-seconds:30}")
    private long shutdownWaitSeconds = 30;

    private ScheduledExecutorService timer;
    private ExecutorService workers;
    private volatile boolean running;

    /**
     * 启动计时线程与工作线程池，并按库中全部启用的任务重建调度。重复调用无副作用。
     */
    public void start() {
        synchronized (lock) {
            if (running) {
                log.debug("调度器已在运行，忽略重复启动");
                return;
            }
            timer = Executors.newSingleThreadScheduledExecutor(namedThreadFactory("qjob-timer"));
            workers = Executors.newFixedThreadPool(workerThreads, namedThreadFactory("qjob-worker"));
            running = true;
        }

        List<ScheduledJobEntity> jobs = scheduledJobRepository.findActive();
        for (ScheduledJobEntity job : jobs) {
            try {
                sync(job);
            } catch (RuntimeException e) {
                log.error("[jobId={}] 启动时同步调度失败", job.getId(), e);
            }
        }
        log.info("调度器已启动: 启用任务 {} 个, 已调度 {} 个, workerThreads={}",
            jobs.size(), handles.size(), workerThreads);
    }

    /**
     * 取消全部调度并停止线程池。执行中的作业不会被中断，最多等待 shutdown-wait-seconds。
     */
    @PreDestroy
    public void shutdown() {
        ExecutorService pool;
        synchronized (lock) {
            if (!running) {
                return;
            }
            running = false;
            handles.values().forEach(ScheduleHandle::cancel);
            handles.clear();
            gates.values().forEach(FiringGate::clearPending);
            gates.clear();
            timer.shutdownNow();
            pool = workers;
            pool.shutdown();
        }
        try {
            if (!pool.awaitTermination(shutdownWaitSeconds, TimeUnit.SECONDS)) {
                log.warn("等待 {} 秒后仍有作业在执行，不再等待", shutdownWaitSeconds);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("调度器已关闭");
    }

    /**
     * 按任务当前持久化的配置重建调度。未启用或调度配置非法时移除已有调度。
     */
    public void sync(ScheduledJobEntity job) {
        Long jobId = job.getId();
        if (!job.isActive()) {
            if (removeHandle(jobId)) {
                log.info("[jobId={}] 任务未启用，已移除调度", jobId);
            }
            return;
        }

        JobTrigger trigger;
        try {
            trigger = triggerBuilder.build(job);
        } catch (ScheduleConfigException e) {
            log.warn("[jobId={}] 调度配置非法，跳过: {}", jobId, e.getMessage());
            removeHandle(jobId);
            return;
        }

        ScheduleHandle handle;
        synchronized (lock) {
            if (!running) {
                log.debug("[jobId={}] 调度器未启动，启动时统一同步", jobId);
                return;
            }
            ScheduleHandle previous = handles.remove(jobId);
            if (previous != null) {
                previous.cancel();
            }
            FiringGate gate = gates.computeIfAbsent(jobId, id -> new FiringGate());
            handle = new ScheduleHandle(jobId, trigger, gate);
            handles.put(jobId, handle);
            scheduleNext(handle, clock.instant());
        }
        log.info("[jobId={}] 已同步调度: {}, 下次触发 {}", jobId, trigger.describe(), handle.getNextFireTime());
    }

    /**
     * 取消任务后续的调度触发，任务不存在时无操作。
     */
    public void remove(Long jobId) {
        if (removeHandle(jobId)) {
            log.info("[jobId={}] 已移除调度", jobId);
        }
    }

    /**
     * 立即在工作线程池中执行一次，与常规调度并行，不检查任务是否启用。
     *
     * @return 任务不存在时返回 false
     */
    public boolean triggerNow(Long jobId) {
        if (!scheduledJobRepository.findById(jobId).isPresent()) {
            log.warn("[jobId={}] 手动触发失败，任务不存在", jobId);
            return false;
        }
        ExecutorService pool;
        synchronized (lock) {
            if (!running) {
                throw new IllegalStateException("调度器未启动");
            }
            pool = workers;
        }
        pool.execute(() -> fire(jobId));
        log.info("[jobId={}] 已提交手动触发", jobId);
        return true;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isScheduled(Long jobId) {
        return handles.containsKey(jobId);
    }

    public Instant nextFireTime(Long jobId) {
        ScheduleHandle handle = handles.get(jobId);
        return handle != null ? handle.getNextFireTime() : null;
    }

    public Set<Long> scheduledJobIds() {
        return Collections.unmodifiableSet(new TreeSet<>(handles.keySet()));
    }

    /**
     * 按调度规则处理一次到期，不重新计算下次触发时间。
     */
    void fireDue(Long jobId) {
        synchronized (lock) {
            ScheduleHandle handle = handles.get(jobId);
            if (handle != null) {
                dispatch(handle);
            }
        }
    }

    private boolean removeHandle(Long jobId) {
        synchronized (lock) {
            ScheduleHandle handle = handles.remove(jobId);
            FiringGate gate = gates.get(jobId);
            if (gate != null) {
                // 移除前合并的待执行不再补跑
                gate.clearPending();
                dropGateIfIdle(jobId);
            }
            if (handle == null) {
                return false;
            }
            handle.cancel();
            return true;
        }
    }

    // 调用方持有 lock
    private void dropGateIfIdle(Long jobId) {
        FiringGate gate = gates.get(jobId);
        if (gate != null && !gate.isRunning() && !handles.containsKey(jobId)) {
            gates.remove(jobId);
        }
    }

    // 调用方持有 lock
    private void scheduleNext(ScheduleHandle handle, Instant from) {
        Long jobId = handle.getJobId();
        Instant next = handle.getTrigger().nextFireTime(from);
        if (next == null) {
            handles.remove(jobId, handle);
            handle.cancel();
            dropGateIfIdle(jobId);
            log.info("[jobId={}] 没有后续触发时刻，移除调度", jobId);
            return;
        }
        handle.setNextFireTime(next);
        long delayMillis = Math.max(0L, Duration.between(clock.instant(), next).toMillis());
        handle.setFuture(timer.schedule(() -> onDue(handle), delayMillis, TimeUnit.MILLISECONDS));
        recordNextRunTime(jobId, next);
    }

    private void onDue(ScheduleHandle handle) {
        synchronized (lock) {
            if (!running || handle.isCancelled() || handles.get(handle.getJobId()) != handle) {
                return;
            }
            Instant scheduledAt = handle.getNextFireTime();
            dispatch(handle);
            Instant now = clock.instant();
            // 停顿后错过的多个周期只补一次
            scheduleNext(handle, now.isAfter(scheduledAt) ? now : scheduledAt);
        }
    }

    private void dispatch(ScheduleHandle handle) {
        Long jobId = handle.getJobId();
        FiringGate gate = handle.getGate();
        if (!gate.tryAcquire()) {
            gate.markPending();
            log.info("[jobId={}] 上一次执行尚未结束，本次触发合并为一次待执行", jobId);
            return;
        }
        try {
            workers.execute(() -> runScheduled(jobId, gate));
        } catch (RejectedExecutionException e) {
            gate.release();
            dropGateIfIdle(jobId);
            log.warn("[jobId={}] 工作线程池已关闭，丢弃本次触发", jobId);
        }
    }

    private void runScheduled(Long jobId, FiringGate gate) {
        boolean again;
        do {
            gate.clearPending();
            try {
                fire(jobId);
            } finally {
                again = continueOrRelease(jobId, gate);
            }
        } while (again);
    }

    /**
     * 有合并的待执行时继续占用闸门，否则释放。与 dispatch 同在 lock 下判断，释放与标记待执行不会交错。
     */
    private boolean continueOrRelease(Long jobId, FiringGate gate) {
        synchronized (lock) {
            if (running && gate.isPending()) {
                return true;
            }
            gate.release();
            dropGateIfIdle(jobId);
            return false;
        }
    }

    private void fire(Long jobId) {
        try {
            executionCoordinator.execute(jobId);
        } catch (Exception e) {
            log.error("[jobId={}] 作业执行出现未处理异常", jobId, e);
        }
    }

    private void recordNextRunTime(Long jobId, Instant next) {
        LocalDateTime nextRunTime = LocalDateTime.ofInstant(next, triggerBuilder.getZone());
        try {
            workers.execute(() -> {
                try {
                    scheduledJobRepository.updateNextRunTime(jobId, nextRunTime);
                } catch (RuntimeException e) {
                    log.warn("[jobId={}] 写入下次执行时间失败: {}", jobId, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("[jobId={}] 工作线程池已关闭，跳过写入下次执行时间", jobId);
        }
    }

    private static ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }
}

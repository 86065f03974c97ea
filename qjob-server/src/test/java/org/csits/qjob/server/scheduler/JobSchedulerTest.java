package org.csits.qjob.server.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.csits.qjob.dao.ScheduleType;
import org.csits.qjob.dao.ScheduledJobEntity;
import org.csits.qjob.dao.ScheduledJobRepository;
import org.csits.qjob.server.service.ExecutionCoordinator;
import org.csits.qjob.server.trigger.TriggerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobSchedulerTest {

    // 每年一次，测试期间不会自然触发
    private static final String YEARLY = "0 0 1 1 *";

    @Mock
    private ScheduledJobRepository scheduledJobRepository;
    @Mock
    private ExecutionCoordinator executionCoordinator;

    private JobScheduler scheduler;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        scheduler = new JobScheduler(scheduledJobRepository, new TriggerBuilder(clock, "UTC"),
            executionCoordinator, clock);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        scheduler.shutdown();
    }

    @Test
    void start_schedulesActiveJobsAndSkipsInvalidOnes() {
        startWith(cronJob(1L, "*/5 * * * *"), cronJob(2L, "not a cron"), intervalJob(3L, 0));

        assertThat(scheduler.isRunning()).isTrue();
        assertThat(scheduler.scheduledJobIds()).containsExactly(1L);
        assertThat(scheduler.nextFireTime(1L)).isAfter(Instant.now());
        assertThat(scheduler.nextFireTime(2L)).isNull();
    }

    @Test
    void start_isIdempotent() {
        startWith(cronJob(1L, YEARLY));

        scheduler.start();

        verify(scheduledJobRepository).findActive();
        assertThat(scheduler.scheduledJobIds()).containsExactly(1L);
    }

    @Test
    void sync_writesAdvisoryNextRunTime() {
        startWith();

        scheduler.sync(cronJob(1L, YEARLY));

        verify(scheduledJobRepository, timeout(2000)).updateNextRunTime(eq(1L), any(LocalDateTime.class));
    }

    @Test
    void sync_inactiveJobLeavesNoFiring() {
        startWith(cronJob(1L, YEARLY));
        ScheduledJobEntity deactivated = cronJob(1L, YEARLY);
        deactivated.setActive(false);

        scheduler.sync(deactivated);
        scheduler.sync(deactivated);

        assertThat(scheduler.isScheduled(1L)).isFalse();
    }

    @Test
    void sync_invalidSpecRemovesExistingHandle() {
        startWith(cronJob(1L, YEARLY));

        scheduler.sync(cronJob(1L, "99 * * * *"));

        assertThat(scheduler.isScheduled(1L)).isFalse();
    }

    @Test
    void sync_replacesTriggerOfScheduledJob() {
        startWith(cronJob(1L, YEARLY));
        Instant yearly = scheduler.nextFireTime(1L);

        scheduler.sync(intervalJob(1L, 3600));

        assertThat(scheduler.isScheduled(1L)).isTrue();
        assertThat(scheduler.nextFireTime(1L)).isNotEqualTo(yearly);
    }

    @Test
    void remove_isIdempotent() {
        startWith(cronJob(1L, YEARLY));

        scheduler.remove(1L);
        scheduler.remove(1L);
        scheduler.remove(99L);

        assertThat(scheduler.isScheduled(1L)).isFalse();
        assertThat(scheduler.scheduledJobIds()).isEmpty();
    }

    @Test
    void dueWhileRunning_collapsesIntoSinglePendingFiring() throws InterruptedException {
        startWith(cronJob(1L, YEARLY));
        CountDownLatch started = new CountDownLatch(1);
        doAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(executionCoordinator).execute(1L);

        scheduler.fireDue(1L);
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        scheduler.fireDue(1L);
        scheduler.fireDue(1L);
        scheduler.fireDue(1L);

        verify(executionCoordinator, after(200).times(1)).execute(1L);
        release.countDown();
        verify(executionCoordinator, timeout(2000).times(2)).execute(1L);
        verify(executionCoordinator, after(300).times(2)).execute(1L);
    }

    @Test
    void deactivateThenReactivate_keepsOneScheduledFiringAtATime() throws InterruptedException {
        startWith(cronJob(1L, YEARLY));
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch started = blockingExecution(active, maxActive);
        ScheduledJobEntity deactivated = cronJob(1L, YEARLY);
        deactivated.setActive(false);

        scheduler.fireDue(1L);
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        scheduler.sync(deactivated);
        scheduler.sync(cronJob(1L, YEARLY));
        scheduler.fireDue(1L);

        verify(executionCoordinator, after(200).times(1)).execute(1L);
        release.countDown();
        verify(executionCoordinator, timeout(2000).times(2)).execute(1L);
        assertThat(maxActive.get()).isEqualTo(1);
    }

    @Test
    void invalidThenFixedSpec_keepsOneScheduledFiringAtATime() throws InterruptedException {
        startWith(cronJob(1L, YEARLY));
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        CountDownLatch started = blockingExecution(active, maxActive);

        scheduler.fireDue(1L);
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        scheduler.sync(cronJob(1L, "99 * * * *"));
        scheduler.sync(intervalJob(1L, 3600));
        scheduler.fireDue(1L);

        verify(executionCoordinator, after(200).times(1)).execute(1L);
        release.countDown();
        verify(executionCoordinator, timeout(2000).times(2)).execute(1L);
        assertThat(maxActive.get()).isEqualTo(1);
    }

    @Test
    void remove_dropsCoalescedPendingFiring() throws InterruptedException {
        startWith(cronJob(1L, YEARLY));
        CountDownLatch started = blockingExecution(new AtomicInteger(), new AtomicInteger());

        scheduler.fireDue(1L);
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        scheduler.fireDue(1L);
        scheduler.remove(1L);
        release.countDown();

        verify(executionCoordinator, after(500).times(1)).execute(1L);
    }

    @Test
    void differentJobsRunConcurrently() throws InterruptedException {
        startWith(cronJob(1L, YEARLY), cronJob(2L, YEARLY));
        CountDownLatch bothStarted = new CountDownLatch(2);
        doAnswer(invocation -> {
            bothStarted.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(executionCoordinator).execute(anyLong());

        scheduler.fireDue(1L);
        scheduler.fireDue(2L);

        assertThat(bothStarted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void triggerNow_runsAlongsideScheduledFiring() throws InterruptedException {
        startWith(cronJob(1L, YEARLY));
        when(scheduledJobRepository.findById(1L)).thenReturn(Optional.of(cronJob(1L, YEARLY)));
        CountDownLatch started = new CountDownLatch(2);
        doAnswer(invocation -> {
            started.countDown();
            release.await(5, TimeUnit.SECONDS);
            return null;
        }).when(executionCoordinator).execute(1L);

        scheduler.fireDue(1L);
        assertThat(scheduler.triggerNow(1L)).isTrue();

        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void triggerNow_ignoresActiveFlag() {
        startWith();
        ScheduledJobEntity inactive = cronJob(4L, YEARLY);
        inactive.setActive(false);
        when(scheduledJobRepository.findById(4L)).thenReturn(Optional.of(inactive));

        assertThat(scheduler.triggerNow(4L)).isTrue();

        verify(executionCoordinator, timeout(2000)).execute(4L);
    }

    @Test
    void triggerNow_returnsFalseForUnknownJob() {
        startWith();
        when(scheduledJobRepository.findById(42L)).thenReturn(Optional.empty());

        assertThat(scheduler.triggerNow(42L)).isFalse();

        verify(executionCoordinator, after(100).never()).execute(42L);
    }

    @Test
    void intervalJob_firesOnItsOwn() {
        startWith(intervalJob(5L, 1));

        verify(executionCoordinator, timeout(3000).atLeastOnce()).execute(5L);
        assertThat(scheduler.isScheduled(5L)).isTrue();
    }

    @Test
    void failingExecution_keepsJobScheduled() {
        startWith(intervalJob(6L, 1));
        when(executionCoordinator.execute(6L)).thenThrow(new IllegalStateException("boom"));

        verify(executionCoordinator, timeout(4000).atLeast(2)).execute(6L);
        assertThat(scheduler.isScheduled(6L)).isTrue();
    }

    @Test
    void shutdown_cancelsEverything() {
        startWith(cronJob(1L, YEARLY), intervalJob(2L, 60));
        when(scheduledJobRepository.findById(1L)).thenReturn(Optional.of(cronJob(1L, YEARLY)));

        scheduler.shutdown();

        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.scheduledJobIds()).isEmpty();
        assertThatThrownBy(() -> scheduler.triggerNow(1L)).isInstanceOf(IllegalStateException.class);
        verify(executionCoordinator, never()).execute(anyLong());
    }

    private CountDownLatch blockingExecution(AtomicInteger active, AtomicInteger maxActive) {
        CountDownLatch started = new CountDownLatch(1);
        doAnswer(invocation -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } finally {
                active.decrementAndGet();
            }
            return null;
        }).when(executionCoordinator).execute(1L);
        return started;
    }

    private void startWith(ScheduledJobEntity... jobs) {
        List<ScheduledJobEntity> active = jobs.length == 0 ? Collections.emptyList() : Arrays.asList(jobs);
        when(scheduledJobRepository.findActive()).thenReturn(active);
        scheduler.start();
    }

    private static ScheduledJobEntity cronJob(Long id, String cron) {
        ScheduledJobEntity job = new ScheduledJobEntity();
        job.setId(id);
        job.setName("job-" + id);
        job.setTemplateId(1L);
        job.setScheduleType(ScheduleType.CRON);
        job.setCronExpression(cron);
        job.setActive(true);
        return job;
    }

    private static ScheduledJobEntity intervalJob(Long id, int seconds) {
        ScheduledJobEntity job = new ScheduledJobEntity();
        job.setId(id);
        job.setName("job-" + id);
        job.setTemplateId(1L);
        job.setScheduleType(ScheduleType.INTERVAL);
        job.setIntervalSeconds(seconds);
        job.setActive(true);
        return job;
    }
}

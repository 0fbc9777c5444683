package at.sv.lights.queue;

import at.sv.lights.ActionExecutor;
import at.sv.lights.ChannelAction;
import at.sv.lights.ExecutionPath;
import at.sv.lights.TestStateScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class DualBackendSchedulerTest {

    private ZonedDateTime now;
    private TestStateScheduler stateScheduler;
    private InMemoryJobStore store;
    private ActionExecutor executor;
    private FallbackTimerScheduler fallback;
    private DualBackendScheduler scheduler;

    @BeforeEach
    void setUp() {
        now = ZonedDateTime.of(2024, 3, 1, 5, 0, 0, 0, ZoneId.of("Europe/Vienna"));
        stateScheduler = new TestStateScheduler();
        store = new InMemoryJobStore();
        executor = mock(ActionExecutor.class);
        fallback = new FallbackTimerScheduler(stateScheduler, executor, () -> now);
        scheduler = new DualBackendScheduler(new DurableQueueScheduler(store, executor, () -> now), fallback, stateScheduler);
    }

    private long toMillis(ZonedDateTime dateTime) {
        return dateTime.toInstant().toEpochMilli();
    }

    @Test
    void start_durableReachable_registersWorkerSweepsAndHealthCheck() {
        scheduler.start();

        assertThat(scheduler.getMode()).isEqualTo(BackendMode.DURABLE);
        assertThat(stateScheduler.getFixedRateTasks()).extracting(TestStateScheduler.FixedRateTask::periodMs)
                                                      .containsExactly(500L, 1000L, 5000L, 30_000L);
    }

    @Test
    void start_durableUnreachable_startsInFallbackMode() {
        store.setAvailable(false);

        scheduler.start();

        assertThat(scheduler.getMode()).isEqualTo(BackendMode.FALLBACK);
    }

    @Test
    void scheduleAction_durableAvailable_usesDurableQueue() {
        JobHandle handle = scheduler.scheduleAction(0, 1, ChannelAction.ON, toMillis(now.plusHours(1)));

        assertThat(handle.backend()).isEqualTo(BackendMode.DURABLE);
        assertThat(store.size()).isOne();
        assertThat(fallback.listPendingJobs()).isEmpty();
    }

    @Test
    void scheduleAction_durableUnreachable_succeedsViaFallback_andExecutesAtTarget() {
        store.setAvailable(false);
        ZonedDateTime target = now.plusHours(1);

        JobHandle handle = scheduler.scheduleAction(0, 1, ChannelAction.ON, toMillis(target));

        assertThat(handle.backend()).isEqualTo(BackendMode.FALLBACK);
        assertThat(scheduler.getMode()).isEqualTo(BackendMode.FALLBACK);
        assertThat(scheduler.listPendingJobs()).hasSize(1);

        now = target;
        stateScheduler.runDueTasks(target);

        verify(executor).execute(1, 0, ChannelAction.ON, ExecutionPath.FALLBACK);
    }

    @Test
    void healthCheck_durableRecovered_switchesBackAndMigratesPendingJobs() {
        store.setAvailable(false);
        scheduler.scheduleAction(0, 1, ChannelAction.ON, toMillis(now.plusHours(1)));
        scheduler.scheduleAction(0, 1, ChannelAction.OFF, toMillis(now.plusHours(2)));

        scheduler.forceHealthCheck();

        assertThat(scheduler.getMode()).isEqualTo(BackendMode.FALLBACK);
        assertThat(fallback.listPendingJobs()).hasSize(2);

        store.setAvailable(true);
        scheduler.forceHealthCheck();

        assertThat(scheduler.getMode()).isEqualTo(BackendMode.DURABLE);
        assertThat(store.getReconnectCount()).isEqualTo(2);
        assertThat(store.size()).isEqualTo(2);
        assertThat(fallback.listPendingJobs()).isEmpty();
        assertThat(scheduler.listPendingJobs()).hasSize(2);

        stateScheduler.runDueTasks(now.plusHours(3));

        verifyNoInteractions(executor);
    }

    @Test
    void healthCheck_durableFails_switchesToFallback_newJobsUseFallback() {
        scheduler.start();
        store.setAvailable(false);

        scheduler.forceHealthCheck();

        assertThat(scheduler.getMode()).isEqualTo(BackendMode.FALLBACK);
        assertThat(scheduler.scheduleAction(0, 1, ChannelAction.ON, toMillis(now.plusHours(1))).backend())
                .isEqualTo(BackendMode.FALLBACK);
    }

    @Test
    void healthCheck_durableHealthy_recoversStalledJobs() {
        store.save(ScheduledJob.builder().key(new JobKey(2, ChannelAction.OFF, 5)).targetTimestamp(toMillis(now.minusMinutes(1)))
                               .attemptsRemaining(3).state(JobState.ACTIVE).activatedAt(toMillis(now.minusMinutes(1))).build());

        scheduler.forceHealthCheck();

        verify(executor).execute(5, 2, ChannelAction.OFF, ExecutionPath.QUEUE_FORCED);
        assertThat(store.size()).isZero();
    }

    @Test
    void sweeps_runOnlyInDurableMode() {
        store.save(ScheduledJob.builder().key(new JobKey(0, ChannelAction.ON, 1)).targetTimestamp(toMillis(now.minusMinutes(1)))
                               .attemptsRemaining(3).state(JobState.DELAYED).build());
        store.setAvailable(false);
        scheduler.start();
        store.setAvailable(true);

        stateScheduler.getFixedRateTasks().subList(0, 3).forEach(task -> task.runnable().run());

        verifyNoInteractions(executor);

        scheduler.forceHealthCheck();
        stateScheduler.getFixedRateTasks().get(0).runnable().run();

        verify(executor).execute(1, 0, ChannelAction.ON, ExecutionPath.QUEUE);
    }

    @Test
    void sweep_backendFailure_switchesToFallback() {
        scheduler.start();
        store.setAvailable(false);

        stateScheduler.getFixedRateTasks().get(0).runnable().run();

        assertThat(scheduler.getMode()).isEqualTo(BackendMode.FALLBACK);
    }

    @Test
    void cancelAll_clearsBothBackends() {
        scheduler.scheduleAction(0, 1, ChannelAction.ON, toMillis(now.plusHours(1)));
        fallback.scheduleAction(1, 2, ChannelAction.ON, toMillis(now.plusHours(1)));

        scheduler.cancelAll();

        assertThat(scheduler.listPendingJobs()).isEmpty();
    }

    @Test
    void cancelAction_removesFromDurableQueue() {
        JobKey key = scheduler.scheduleAction(0, 1, ChannelAction.ON, toMillis(now.plusHours(1))).key();

        assertThat(scheduler.cancelAction(key)).isTrue();
        assertThat(store.size()).isZero();
    }

    @Test
    void noDurableBackend_alwaysUsesFallback_healthCheckIsNoop() {
        scheduler = new DualBackendScheduler(null, fallback, stateScheduler);
        scheduler.start();

        JobHandle handle = scheduler.scheduleAction(0, 1, ChannelAction.ON, toMillis(now.plusHours(1)));
        scheduler.forceHealthCheck();
        stateScheduler.runFixedRateTasks();

        assertThat(handle.backend()).isEqualTo(BackendMode.FALLBACK);
        assertThat(scheduler.getMode()).isEqualTo(BackendMode.FALLBACK);
        assertThat(scheduler.listPendingJobs()).hasSize(1);
    }

    @Test
    void scheduleAction_storeLostAfterInlineExecution_executesOnlyOnce_notHandedToFallback() {
        when(executor.execute(1, 0, ChannelAction.ON, ExecutionPath.QUEUE_IMMEDIATE)).thenAnswer(invocation -> {
            store.setAvailable(false);
            return "CMD: LED 0 ON persistently";
        });

        JobHandle handle = scheduler.scheduleAction(0, 1, ChannelAction.ON, toMillis(now));

        assertThat(handle.executed()).isTrue();
        assertThat(scheduler.getMode()).isEqualTo(BackendMode.FALLBACK);
        assertThat(fallback.listPendingJobs()).isEmpty();
        verify(executor).execute(1, 0, ChannelAction.ON, ExecutionPath.QUEUE_IMMEDIATE);
        verifyNoMoreInteractions(executor);
    }

    @Test
    void healthCheck_afterExecutedJobCouldNotBeRemoved_removesStaleJobOnRecovery() {
        when(executor.execute(1, 0, ChannelAction.ON, ExecutionPath.QUEUE_IMMEDIATE)).thenAnswer(invocation -> {
            store.setAvailable(false);
            return "CMD: LED 0 ON persistently";
        });
        scheduler.scheduleAction(0, 1, ChannelAction.ON, toMillis(now));
        store.setAvailable(true);

        scheduler.forceHealthCheck();
        now = now.plusMinutes(1);
        stateScheduler.runFixedRateTasks();

        assertThat(scheduler.getMode()).isEqualTo(BackendMode.DURABLE);
        assertThat(store.size()).isZero();
        verify(executor).execute(1, 0, ChannelAction.ON, ExecutionPath.QUEUE_IMMEDIATE);
        verifyNoMoreInteractions(executor);
    }

    @Test
    void overdueSweep_storeLostAfterExecution_jobIsNotExecutedAgainAfterRecovery() {
        store.save(ScheduledJob.builder().key(new JobKey(2, ChannelAction.OFF, 5)).targetTimestamp(toMillis(now.minusMinutes(1)))
                               .attemptsRemaining(3).state(JobState.DELAYED).build());
        when(executor.execute(5, 2, ChannelAction.OFF, ExecutionPath.QUEUE_FORCED)).thenAnswer(invocation -> {
            store.setAvailable(false);
            return "CMD: LED 2 OFF persistently";
        });
        scheduler.start();

        stateScheduler.getFixedRateTasks().get(2).runnable().run();

        assertThat(scheduler.getMode()).isEqualTo(BackendMode.FALLBACK);

        store.setAvailable(true);
        scheduler.forceHealthCheck();
        stateScheduler.runFixedRateTasks();

        assertThat(store.size()).isZero();
        verify(executor).execute(5, 2, ChannelAction.OFF, ExecutionPath.QUEUE_FORCED);
        verifyNoMoreInteractions(executor);
    }
}

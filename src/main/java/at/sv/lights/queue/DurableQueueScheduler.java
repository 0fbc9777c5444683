package at.sv.lights.queue;

import at.sv.lights.ActionExecutionFailure;
import at.sv.lights.ActionExecutor;
import at.sv.lights.ChannelAction;
import at.sv.lights.ExecutionPath;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs jobs from a {@link JobStore}. Nothing here runs on its own: the worker tick, the sweeps and the stall
 * recovery are driven by {@link DualBackendScheduler} from the event loop.
 */
@Slf4j
public final class DurableQueueScheduler implements ActionScheduler {

    static final long IMMEDIATE_THRESHOLD_MS = 1000;
    static final long PROMOTION_HORIZON_MS = 2000;
    static final long OVERDUE_THRESHOLD_MS = 2000;
    static final long STALL_THRESHOLD_MS = 30_000;
    static final int MAX_ATTEMPTS = 3;
    static final long BACKOFF_BASE_MS = 2000;

    private final JobStore store;
    private final ActionExecutor executor;
    private final Supplier<ZonedDateTime> currentTime;

    public DurableQueueScheduler(JobStore store, ActionExecutor executor, Supplier<ZonedDateTime> currentTime) {
        this.store = store;
        this.executor = executor;
        this.currentTime = currentTime;
    }

    @Override
    public JobHandle scheduleAction(int channelId, long scheduleId, ChannelAction action, long targetTimestamp) {
        JobKey key = new JobKey(channelId, action, scheduleId);
        store.remove(key);
        long delay = Math.max(0, targetTimestamp - now());
        boolean immediate = delay <= IMMEDIATE_THRESHOLD_MS;
        ScheduledJob job = ScheduledJob.builder()
                                       .key(key)
                                       .targetTimestamp(targetTimestamp)
                                       .attemptsRemaining(MAX_ATTEMPTS)
                                       .state(immediate ? JobState.WAITING : JobState.DELAYED)
                                       .build();
        store.save(job);
        if (immediate) {
            log.info("Job {} is due in {}ms, executing immediately", key, delay);
            executeAndRemove(job, ExecutionPath.QUEUE_IMMEDIATE);
        } else {
            log.info("Scheduled job {} in {}s", key, delay / 1000);
        }
        return new JobHandle(key, targetTimestamp, BackendMode.DURABLE, immediate);
    }

    @Override
    public boolean cancelAction(JobKey key) {
        boolean removed = store.remove(key);
        if (removed) {
            log.debug("Cancelled job {}", key);
        }
        return removed;
    }

    @Override
    public List<PendingJob> listPendingJobs() {
        List<PendingJob> pending = new ArrayList<>();
        store.findByState(JobState.DELAYED).forEach(job -> pending.add(job.toPendingJob()));
        store.findByState(JobState.WAITING).forEach(job -> pending.add(job.toPendingJob()));
        return pending;
    }

    @Override
    public void cancelAll() {
        store.removeAll();
        log.info("Cleared all durable jobs");
    }

    /**
     * Worker tick: promotes due delayed jobs and runs all waiting ones. Failed jobs are retried with exponential
     * backoff until their attempts are used up.
     */
    public void processDueJobs() {
        long now = now();
        for (ScheduledJob job : store.findByState(JobState.DELAYED)) {
            if (job.getDueTimestamp() <= now) {
                job.setState(JobState.WAITING);
                store.save(job);
            }
        }
        for (ScheduledJob job : store.findByState(JobState.WAITING)) {
            job.setState(JobState.ACTIVE);
            job.setActivatedAt(now());
            job.setRetryAt(null);
            store.save(job);
            runAttempt(job);
        }
    }

    /**
     * Executes delayed jobs that are due within the promotion horizon right away, instead of waiting for the
     * worker. Jobs waiting for a retry are left to the worker.
     */
    public void promoteImminentJobs() {
        long now = now();
        for (ScheduledJob job : store.findByState(JobState.DELAYED)) {
            if (!job.isWaitingForRetry() && job.getTargetTimestamp() - now <= PROMOTION_HORIZON_MS) {
                log.info("Job {} is due in {}ms, promoting", job.getKey(), job.getTargetTimestamp() - now);
                executeAndRemove(job, ExecutionPath.QUEUE_IMMEDIATE);
            }
        }
    }

    public void forceOverdueJobs() {
        long now = now();
        List<ScheduledJob> candidates = new ArrayList<>();
        candidates.addAll(store.findByState(JobState.DELAYED));
        candidates.addAll(store.findByState(JobState.WAITING));
        candidates.addAll(store.findByState(JobState.ACTIVE));
        for (ScheduledJob job : candidates) {
            long overdue = now - job.getDueTimestamp();
            if (overdue > OVERDUE_THRESHOLD_MS) {
                log.warn("Job {} ({}) is {}ms overdue, forcing execution", job.getKey(), job.getState(), overdue);
                executeAndRemove(job, ExecutionPath.QUEUE_FORCED);
            }
        }
    }

    /**
     * @return the number of active jobs that were stuck and have been force-executed
     */
    public int recoverStalledJobs() {
        long now = now();
        int recovered = 0;
        for (ScheduledJob job : store.findByState(JobState.ACTIVE)) {
            Long activatedAt = job.getActivatedAt();
            if (activatedAt != null && now - activatedAt > STALL_THRESHOLD_MS) {
                log.warn("Job {} active for {}s, forcing execution", job.getKey(), (now - activatedAt) / 1000);
                executeAndRemove(job, ExecutionPath.QUEUE_FORCED);
                recovered++;
            }
        }
        return recovered;
    }

    public Map<JobState, Long> countJobs() {
        return store.countByState();
    }

    public void ping() {
        store.ping();
    }

    public void reconnect() {
        store.reconnect();
    }

    private void runAttempt(ScheduledJob job) {
        try {
            execute(job, ExecutionPath.QUEUE);
        } catch (ActionExecutionFailure e) {
            handleFailedAttempt(job, e);
            return;
        }
        removeExecuted(job.getKey());
    }

    private void handleFailedAttempt(ScheduledJob job, ActionExecutionFailure failure) {
        int remaining = job.getAttemptsRemaining() - 1;
        if (remaining <= 0) {
            log.error("Job {} failed after {} attempts, giving up: {}", job.getKey(), MAX_ATTEMPTS, failure.getMessage());
            store.remove(job.getKey());
            return;
        }
        int attemptsMade = MAX_ATTEMPTS - remaining;
        long backoff = BACKOFF_BASE_MS * (1L << (attemptsMade - 1));
        job.setAttemptsRemaining(remaining);
        job.setState(JobState.DELAYED);
        job.setActivatedAt(null);
        job.setRetryAt(now() + backoff);
        store.save(job);
        log.warn("Job {} failed, retrying in {}ms ({} attempt(s) left): {}", job.getKey(), backoff, remaining,
                failure.getMessage());
    }

    private void executeAndRemove(ScheduledJob job, ExecutionPath path) {
        try {
            execute(job, path);
        } catch (ActionExecutionFailure e) {
            log.warn("Job {} failed via {}, not retrying: {}", job.getKey(), path.label(), e.getMessage());
        }
        removeExecuted(job.getKey());
    }

    private void removeExecuted(JobKey key) {
        try {
            store.remove(key);
        } catch (BackendUnavailableFailure e) {
            throw new ExecutedJobRemovalFailure(key, e);
        }
    }

    private void execute(ScheduledJob job, ExecutionPath path) {
        JobKey key = job.getKey();
        executor.execute(key.scheduleId(), key.channelId(), key.action(), path);
    }

    private long now() {
        return currentTime.get().toInstant().toEpochMilli();
    }
}

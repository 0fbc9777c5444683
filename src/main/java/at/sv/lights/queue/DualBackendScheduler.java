package at.sv.lights.queue;

import at.sv.lights.ChannelAction;
import at.sv.lights.StateScheduler;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Dispatches to the durable queue while it is reachable and to in-process timers otherwise. Backend failures
 * never reach the caller: the call is completed by the fallback and the health check switches back once the
 * durable backend is reachable again.
 */
@Slf4j
public final class DualBackendScheduler implements ActionScheduler {

    static final long WORKER_INTERVAL_MS = 500;
    static final long IMMEDIATE_SWEEP_INTERVAL_MS = 1000;
    static final long OVERDUE_SWEEP_INTERVAL_MS = 5000;
    static final long HEALTH_CHECK_INTERVAL_MS = 30_000;

    private final DurableQueueScheduler durable;
    private final FallbackTimerScheduler fallback;
    private final StateScheduler stateScheduler;
    /**
     * Already executed jobs left behind in the durable store, removed again on recovery.
     */
    private final Set<JobKey> staleDurableJobs = new LinkedHashSet<>();

    private BackendMode mode;

    /**
     * @param durable the durable backend, or {@code null} to only ever use the fallback
     */
    public DualBackendScheduler(DurableQueueScheduler durable, FallbackTimerScheduler fallback,
                                StateScheduler stateScheduler) {
        this.durable = durable;
        this.fallback = fallback;
        this.stateScheduler = stateScheduler;
        this.mode = durable != null ? BackendMode.DURABLE : BackendMode.FALLBACK;
    }

    /**
     * Verifies the durable backend and registers the worker, the sweeps and the health check.
     */
    public synchronized void start() {
        if (durable != null) {
            try {
                durable.ping();
                log.info("Durable backend reachable, using durable job queues.");
            } catch (BackendUnavailableFailure e) {
                degrade(e);
            }
        } else {
            log.info("No durable backend configured, using fallback timers only.");
        }
        stateScheduler.scheduleAtFixedRate(() -> runSweep(DurableQueueScheduler::processDueJobs),
                WORKER_INTERVAL_MS, WORKER_INTERVAL_MS, TimeUnit.MILLISECONDS);
        stateScheduler.scheduleAtFixedRate(() -> runSweep(DurableQueueScheduler::promoteImminentJobs),
                IMMEDIATE_SWEEP_INTERVAL_MS, IMMEDIATE_SWEEP_INTERVAL_MS, TimeUnit.MILLISECONDS);
        stateScheduler.scheduleAtFixedRate(() -> runSweep(DurableQueueScheduler::forceOverdueJobs),
                OVERDUE_SWEEP_INTERVAL_MS, OVERDUE_SWEEP_INTERVAL_MS, TimeUnit.MILLISECONDS);
        stateScheduler.scheduleAtFixedRate(this::forceHealthCheck,
                HEALTH_CHECK_INTERVAL_MS, HEALTH_CHECK_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized JobHandle scheduleAction(int channelId, long scheduleId, ChannelAction action, long targetTimestamp) {
        if (mode == BackendMode.DURABLE) {
            try {
                return durable.scheduleAction(channelId, scheduleId, action, targetTimestamp);
            } catch (ExecutedJobRemovalFailure e) {
                degrade(e);
                return new JobHandle(e.getKey(), targetTimestamp, BackendMode.DURABLE, true);
            } catch (BackendUnavailableFailure e) {
                degrade(e);
            }
        }
        return fallback.scheduleAction(channelId, scheduleId, action, targetTimestamp);
    }

    @Override
    public synchronized boolean cancelAction(JobKey key) {
        boolean removed = fallback.cancelAction(key);
        if (mode == BackendMode.DURABLE) {
            try {
                removed |= durable.cancelAction(key);
            } catch (BackendUnavailableFailure e) {
                degrade(e);
            }
        }
        return removed;
    }

    @Override
    public synchronized List<PendingJob> listPendingJobs() {
        List<PendingJob> pending = new ArrayList<>(fallback.listPendingJobs());
        if (mode == BackendMode.DURABLE) {
            try {
                pending.addAll(durable.listPendingJobs());
            } catch (BackendUnavailableFailure e) {
                degrade(e);
            }
        }
        return pending;
    }

    @Override
    public synchronized void cancelAll() {
        fallback.cancelAll();
        if (mode == BackendMode.DURABLE) {
            try {
                durable.cancelAll();
            } catch (BackendUnavailableFailure e) {
                degrade(e);
            }
        }
    }

    public synchronized BackendMode getMode() {
        return mode;
    }

    /**
     * In durable mode verifies the backend and recovers stalled jobs. In fallback mode tries to reconnect and,
     * on success, moves the pending fallback timers into the durable queues.
     */
    public synchronized void forceHealthCheck() {
        if (durable == null) {
            return;
        }
        MDC.put("context", "health");
        if (mode == BackendMode.DURABLE) {
            try {
                durable.ping();
                Map<JobState, Long> counts = durable.countJobs();
                log.debug("Durable backend healthy, jobs: {}", counts);
                int recovered = durable.recoverStalledJobs();
                if (recovered > 0) {
                    log.warn("Recovered {} stalled job(s)", recovered);
                }
                return;
            } catch (BackendUnavailableFailure e) {
                degrade(e);
            }
        }
        tryRecover();
    }

    private void tryRecover() {
        try {
            durable.reconnect();
            durable.ping();
        } catch (BackendUnavailableFailure e) {
            log.warn("Durable backend still unavailable: {}", e.getMessage());
            return;
        }
        if (!removeStaleDurableJobs()) {
            return;
        }
        List<PendingJob> pending = fallback.drainPending();
        mode = BackendMode.DURABLE;
        log.info("Durable backend recovered, moving {} pending fallback job(s) to the durable queues.", pending.size());
        for (int i = 0; i < pending.size(); i++) {
            PendingJob job = pending.get(i);
            JobKey key = job.key();
            try {
                durable.scheduleAction(key.channelId(), key.scheduleId(), key.action(), job.targetTimestamp());
            } catch (BackendUnavailableFailure e) {
                degrade(e);
                int firstRemaining = e instanceof ExecutedJobRemovalFailure ? i + 1 : i;
                pending.subList(firstRemaining, pending.size()).forEach(remaining -> fallback.scheduleAction(
                        remaining.key().channelId(), remaining.key().scheduleId(), remaining.key().action(),
                        remaining.targetTimestamp()));
                return;
            }
        }
    }

    private boolean removeStaleDurableJobs() {
        Iterator<JobKey> iterator = staleDurableJobs.iterator();
        while (iterator.hasNext()) {
            JobKey key = iterator.next();
            try {
                durable.cancelAction(key);
            } catch (BackendUnavailableFailure e) {
                log.warn("Could not remove already executed job {}: {}", key, e.getMessage());
                return false;
            }
            log.info("Removed already executed job {} from the durable queues", key);
            iterator.remove();
        }
        return true;
    }

    private synchronized void runSweep(SweepTask task) {
        if (mode != BackendMode.DURABLE) {
            return;
        }
        MDC.put("context", "sweep");
        try {
            task.run(durable);
        } catch (BackendUnavailableFailure e) {
            degrade(e);
        }
    }

    private void degrade(BackendUnavailableFailure failure) {
        if (failure instanceof ExecutedJobRemovalFailure) {
            staleDurableJobs.add(((ExecutedJobRemovalFailure) failure).getKey());
        }
        if (mode == BackendMode.DURABLE) {
            log.warn("Durable backend unavailable, switching to fallback timers: {}", failure.getMessage());
        }
        mode = BackendMode.FALLBACK;
    }

    @FunctionalInterface
    private interface SweepTask {
        void run(DurableQueueScheduler durable);
    }
}

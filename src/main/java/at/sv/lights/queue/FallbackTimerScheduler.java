package at.sv.lights.queue;

import at.sv.lights.ActionExecutionFailure;
import at.sv.lights.ActionExecutor;
import at.sv.lights.ChannelAction;
import at.sv.lights.ExecutionPath;
import at.sv.lights.StateScheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * In-process timers used while the durable backend is unavailable. Pending timers do not survive a restart.
 */
@Slf4j
public final class FallbackTimerScheduler implements ActionScheduler {

    private final StateScheduler stateScheduler;
    private final ActionExecutor executor;
    private final Supplier<ZonedDateTime> currentTime;
    private final Map<JobKey, Timer> timers = new ConcurrentHashMap<>();

    public FallbackTimerScheduler(StateScheduler stateScheduler, ActionExecutor executor,
                                  Supplier<ZonedDateTime> currentTime) {
        this.stateScheduler = stateScheduler;
        this.executor = executor;
        this.currentTime = currentTime;
    }

    @Override
    public JobHandle scheduleAction(int channelId, long scheduleId, ChannelAction action, long targetTimestamp) {
        JobKey key = new JobKey(channelId, action, scheduleId);
        cancelAction(key);
        ZonedDateTime now = currentTime.get();
        long delay = targetTimestamp - now.toInstant().toEpochMilli();
        if (delay <= 0) {
            log.info("Fallback job {} is due, executing immediately", key);
            fire(key);
        } else {
            ZonedDateTime start = Instant.ofEpochMilli(targetTimestamp).atZone(now.getZone());
            CompletableFuture<Timer> self = new CompletableFuture<>();
            Future<?> future = stateScheduler.schedule(() -> {
                // a timer replaced or cancelled after it started must not fire
                if (timers.remove(key, self.join())) {
                    fire(key);
                }
            }, start);
            Timer timer = new Timer(targetTimestamp, future);
            timers.put(key, timer);
            self.complete(timer);
            log.info("Scheduled fallback job {} at {}", key, start);
        }
        return new JobHandle(key, targetTimestamp, BackendMode.FALLBACK, delay <= 0);
    }

    @Override
    public boolean cancelAction(JobKey key) {
        Timer timer = timers.remove(key);
        if (timer == null) {
            return false;
        }
        timer.future().cancel(false);
        return true;
    }

    @Override
    public List<PendingJob> listPendingJobs() {
        List<PendingJob> pending = new ArrayList<>();
        timers.forEach((key, timer) -> pending.add(new PendingJob(key, timer.targetTimestamp(), JobState.DELAYED)));
        pending.sort(Comparator.comparingLong(PendingJob::targetTimestamp));
        return pending;
    }

    @Override
    public void cancelAll() {
        timers.values().forEach(timer -> timer.future().cancel(false));
        timers.clear();
    }

    /**
     * Cancels all timers and returns the jobs they would have fired, to be handed over to another backend.
     */
    public List<PendingJob> drainPending() {
        List<PendingJob> pending = listPendingJobs();
        cancelAll();
        return pending;
    }

    private void fire(JobKey key) {
        try {
            executor.execute(key.scheduleId(), key.channelId(), key.action(), ExecutionPath.FALLBACK);
        } catch (ActionExecutionFailure e) {
            log.warn("Fallback job {} failed: {}", key, e.getMessage());
        }
    }

    private record Timer(long targetTimestamp, Future<?> future) {
    }
}

package at.sv.lights;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

@Slf4j
public final class StateSchedulerImpl implements StateScheduler {

    private final ScheduledExecutorService scheduler;
    private final Supplier<ZonedDateTime> currentTime;

    public StateSchedulerImpl(ScheduledExecutorService scheduler, Supplier<ZonedDateTime> currentTime) {
        this.scheduler = scheduler;
        this.currentTime = currentTime;
    }

    @Override
    public Future<?> schedule(Runnable runnable, ZonedDateTime start) {
        long delay = Math.max(0, Duration.between(currentTime.get(), start).toMillis());
        return scheduler.schedule(logUncaughtException(runnable), delay, TimeUnit.MILLISECONDS);
    }

    @Override
    public void scheduleAtFixedRate(Runnable runnable, long initialDelay, long period, TimeUnit unit) {
        scheduler.scheduleAtFixedRate(logUncaughtException(runnable), initialDelay, period, unit);
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }

    /**
     * A task throwing out of a fixed rate schedule would silently cancel all its further executions.
     */
    private Runnable logUncaughtException(Runnable runnable) {
        return () -> {
            try {
                runnable.run();
            } catch (Exception e) {
                log.error("Uncaught exception: {}", e.getLocalizedMessage(), e);
            } finally {
                MDC.remove("context");
            }
        };
    }
}

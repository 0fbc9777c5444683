package at.sv.lights;

import java.time.ZonedDateTime;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * The single event loop all timers of the scheduler run on. Implementations execute every task on one thread,
 * so tasks never run concurrently with each other.
 */
public interface StateScheduler {
    /**
     * @return a handle that can be used to cancel the task before it started
     */
    Future<?> schedule(Runnable runnable, ZonedDateTime start);

    void scheduleAtFixedRate(Runnable runnable, long initialDelay, long period, TimeUnit unit);
}

package at.sv.lights;

import lombok.Getter;

import java.time.ZonedDateTime;
import java.util.concurrent.CompletableFuture;

@Getter
public final class ScheduledRunnable implements Runnable {
    private final ZonedDateTime start;
    private final Runnable runnable;
    private final CompletableFuture<Void> future = new CompletableFuture<>();

    ScheduledRunnable(ZonedDateTime start, Runnable runnable) {
        this.start = start;
        this.runnable = runnable;
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }

    @Override
    public void run() {
        if (isCancelled()) {
            return;
        }
        runnable.run();
        future.complete(null);
    }

    @Override
    public String toString() {
        return "ScheduledRunnable{" +
               "start=" + start +
               ", cancelled=" + isCancelled() +
               '}';
    }
}

package at.sv.lights.queue;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * A job of the durable queue. All timestamps are epoch millis.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
public final class ScheduledJob {
    private final JobKey key;
    private final long targetTimestamp;
    private int attemptsRemaining;
    private JobState state;
    /**
     * Set while {@link JobState#ACTIVE}.
     */
    private Long activatedAt;
    /**
     * Set while a failed job waits for its next attempt.
     */
    private Long retryAt;

    public long getDueTimestamp() {
        return retryAt != null ? retryAt : targetTimestamp;
    }

    public boolean isWaitingForRetry() {
        return retryAt != null;
    }

    public PendingJob toPendingJob() {
        return new PendingJob(key, targetTimestamp, state);
    }
}

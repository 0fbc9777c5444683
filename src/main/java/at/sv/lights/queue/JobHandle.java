package at.sv.lights.queue;

/**
 * @param executed whether the action already ran before {@code scheduleAction} returned
 */
public record JobHandle(JobKey key, long targetTimestamp, BackendMode backend, boolean executed) {
}

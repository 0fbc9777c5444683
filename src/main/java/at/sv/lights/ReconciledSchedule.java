package at.sv.lights;

/**
 * The occurrences submitted for one schedule by a reconciliation run, as epoch millis.
 */
public record ReconciledSchedule(long scheduleId, int channelId, long onTimestamp, long offTimestamp) {
}

package at.sv.lights;

import java.time.Instant;

/**
 * Audit record of one executed action.
 *
 * @param message the device response on success, the failure message otherwise
 */
public record EventLogEntry(long scheduleId, int channelId, ChannelAction action, boolean success, String message,
                            Instant timestamp, ExecutionPath executionPath) {

    public static EventLogEntry success(long scheduleId, int channelId, ChannelAction action, String response,
                                        Instant timestamp, ExecutionPath executionPath) {
        return new EventLogEntry(scheduleId, channelId, action, true, response, timestamp, executionPath);
    }

    public static EventLogEntry failure(long scheduleId, int channelId, ChannelAction action, String error,
                                        Instant timestamp, ExecutionPath executionPath) {
        return new EventLogEntry(scheduleId, channelId, action, false, error, timestamp, executionPath);
    }
}

package at.sv.lights.queue;

import at.sv.lights.ChannelAction;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies the job firing one action of one schedule. At most one pending job exists per key.
 */
public record JobKey(int channelId, ChannelAction action, long scheduleId) {

    private static final Pattern ID_PATTERN = Pattern.compile("channel-(\\d+)-(on|off)-(\\d+)");

    public String id() {
        return "channel-" + channelId + "-" + action.label() + "-" + scheduleId;
    }

    public static JobKey parse(String id) {
        Matcher matcher = ID_PATTERN.matcher(id);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid job id '" + id + "'");
        }
        return new JobKey(Integer.parseInt(matcher.group(1)), ChannelAction.fromLabel(matcher.group(2)),
                Long.parseLong(matcher.group(3)));
    }

    @Override
    public String toString() {
        return id();
    }
}

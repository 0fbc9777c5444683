package at.sv.lights;

import lombok.Builder;

import java.time.Instant;
import java.time.LocalTime;

/**
 * A daily ON/OFF schedule for one channel, owned by the {@link at.sv.lights.persistence.ScheduleRepository}.
 *
 * @param lastAppliedAt when the schedule was last submitted or directly executed, {@code null} if never
 */
@Builder(toBuilder = true)
public record ScheduleDefinition(long id, int channelId, int onHour, int onMinute, int offHour, int offMinute,
                                 boolean active, Instant lastAppliedAt) {

    public void validate(int channelCount) {
        if (channelId < 0 || channelId >= channelCount) {
            throw new InvalidScheduleDefinition("Schedule " + id + ": invalid channel id " + channelId +
                                                ". Must be between 0 and " + (channelCount - 1) + ".");
        }
        assertValidTime("on", onHour, onMinute);
        assertValidTime("off", offHour, offMinute);
    }

    private void assertValidTime(String name, int hour, int minute) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new InvalidScheduleDefinition("Schedule " + id + ": invalid " + name + " time " + hour + ":" + minute);
        }
    }

    public LocalTime onTime() {
        return LocalTime.of(onHour, onMinute);
    }

    public LocalTime offTime() {
        return LocalTime.of(offHour, offMinute);
    }

    public LocalTime timeOf(ChannelAction action) {
        return action == ChannelAction.ON ? onTime() : offTime();
    }

    @Override
    public String toString() {
        return "{id=" + id + ", channel=" + channelId +
               String.format(", on=%02d:%02d, off=%02d:%02d", onHour, onMinute, offHour, offMinute) +
               (active ? "" : ", inactive") + "}";
    }
}

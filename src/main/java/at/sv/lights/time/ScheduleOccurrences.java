package at.sv.lights.time;

import java.time.ZonedDateTime;

public record ScheduleOccurrences(ZonedDateTime on, ZonedDateTime off) {
}

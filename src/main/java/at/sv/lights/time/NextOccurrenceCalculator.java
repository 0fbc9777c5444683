package at.sv.lights.time;

import java.time.LocalTime;
import java.time.ZonedDateTime;

public final class NextOccurrenceCalculator {

    /**
     * @return today at the given time if that is still in the future, otherwise tomorrow at that time
     */
    public ZonedDateTime nextOccurrence(LocalTime time, ZonedDateTime now) {
        ZonedDateTime today = now.with(time);
        if (today.isAfter(now)) {
            return today;
        }
        return now.plusDays(1).with(time);
    }

    /**
     * Calculates the next ON and OFF occurrence independently. An OFF occurrence before the ON occurrence is
     * moved one day forward, so that schedules spanning midnight turn off after they turned on.
     */
    public ScheduleOccurrences nextOccurrences(LocalTime on, LocalTime off, ZonedDateTime now) {
        ZonedDateTime nextOn = nextOccurrence(on, now);
        ZonedDateTime nextOff = nextOccurrence(off, now);
        if (nextOff.isBefore(nextOn)) {
            nextOff = nextOff.plusDays(1);
        }
        return new ScheduleOccurrences(nextOn, nextOff);
    }
}

package at.sv.lights.persistence;

import at.sv.lights.ScheduleDefinition;

import java.time.Instant;
import java.util.List;

/**
 * Source of the schedule definitions. Definitions are created and edited elsewhere; the scheduler only reads
 * them and records when they were last applied.
 */
public interface ScheduleRepository {
    List<ScheduleDefinition> listActiveSchedules();

    void updateLastApplied(long scheduleId, Instant timestamp);
}

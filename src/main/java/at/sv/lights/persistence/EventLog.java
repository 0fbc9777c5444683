package at.sv.lights.persistence;

import at.sv.lights.EventLogEntry;

public interface EventLog {
    void append(EventLogEntry entry);
}

package at.sv.lights;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which mechanism ended up executing an action. Recorded with every event log entry.
 */
public enum ExecutionPath {
    /** Regular durable queue worker. */
    QUEUE("queue"),
    /** Executed inline on submission or by the immediate promotion sweep. */
    QUEUE_IMMEDIATE("queue-immediate"),
    /** Recovered by the overdue sweep or the stall recovery. */
    QUEUE_FORCED("queue-forced"),
    FALLBACK("fallback"),
    DIRECT_SWEEP("direct-sweep");

    private final String label;

    ExecutionPath(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}

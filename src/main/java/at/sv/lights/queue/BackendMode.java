package at.sv.lights.queue;

public enum BackendMode {
    DURABLE,
    FALLBACK
}

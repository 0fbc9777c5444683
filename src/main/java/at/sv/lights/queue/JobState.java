package at.sv.lights.queue;

public enum JobState {
    DELAYED,
    WAITING,
    ACTIVE,
    DONE;

    public boolean isPending() {
        return this == DELAYED || this == WAITING;
    }
}

package at.sv.lights;

public final class InvalidScheduleDefinition extends IllegalArgumentException {
    public InvalidScheduleDefinition(String message) {
        super(message);
    }
}

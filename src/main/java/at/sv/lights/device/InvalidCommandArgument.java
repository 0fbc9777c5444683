package at.sv.lights.device;

public final class InvalidCommandArgument extends IllegalArgumentException {
    public InvalidCommandArgument(String message) {
        super(message);
    }
}

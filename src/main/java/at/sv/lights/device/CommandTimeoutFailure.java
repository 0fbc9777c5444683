package at.sv.lights.device;

/**
 * No matching response arrived within the command timeout.
 */
public final class CommandTimeoutFailure extends DeviceFailure {
    public CommandTimeoutFailure(String message) {
        super(message);
    }
}

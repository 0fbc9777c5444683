package at.sv.lights.device;

/**
 * The device answered a command with an {@code Error:} line.
 */
public final class DeviceReportedFailure extends DeviceFailure {
    public DeviceReportedFailure(String message) {
        super(message);
    }
}

package at.sv.lights.device;

public final class DeviceWriteFailure extends DeviceFailure {
    public DeviceWriteFailure(String message, Throwable cause) {
        super(message, cause);
    }
}

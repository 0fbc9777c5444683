package at.sv.lights.device;

/**
 * Base class of all failures raised while talking to the device. Callers treat them as "degraded but operating":
 * the channel keeps reconnecting in the background.
 */
public class DeviceFailure extends RuntimeException {
    public DeviceFailure(String message) {
        super(message);
    }

    public DeviceFailure(String message, Throwable cause) {
        super(message, cause);
    }
}

package at.sv.lights.device;

/**
 * A single line received from the device, classified by its leading token.
 */
public sealed interface DeviceResponse {

    String text();

    /**
     * {@code CMD:}, {@code ACK:} and the motion sensor confirmations.
     */
    record Acknowledgement(String text) implements DeviceResponse {
    }

    record DeviceError(String text) implements DeviceResponse {
    }

    record StatusReport(String text, DeviceStatus status) implements DeviceResponse {
    }

    record PowerReport(String text) implements DeviceResponse {
    }

    record Info(String text) implements DeviceResponse {
    }

    record Unrecognized(String text) implements DeviceResponse {
    }
}

package at.sv.lights.device;

/**
 * A command was attempted while the serial stream was closed, or the stream failed while a command was waiting
 * for its response.
 */
public final class ChannelNotOpenFailure extends DeviceFailure {
    public ChannelNotOpenFailure(String message) {
        super(message);
    }
}

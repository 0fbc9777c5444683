package at.sv.lights.device;

import java.util.function.Consumer;

/**
 * Request/response exchange with the device over a line oriented stream.
 * <p>
 * At most one command is in flight at any time. Concurrent callers of {@link #sendCommand(String, String)} are
 * served in arrival order.
 */
public interface DeviceCommandChannel {

    /**
     * Opens the underlying stream. Failing to open is not reported to the caller but handled like a stream
     * failure: the channel stays closed and retries after the reconnect delay.
     */
    void open();

    /**
     * Writes the given command and blocks until a line starting with {@code expectedResponsePrefix} arrives.
     *
     * @return the full response line
     * @throws ChannelNotOpenFailure  if the stream is closed, or fails while waiting
     * @throws DeviceReportedFailure  if the device answers with an error line
     * @throws CommandTimeoutFailure  if no matching line arrives in time
     * @throws DeviceWriteFailure     if the command could not be written
     */
    String sendCommand(String command, String expectedResponsePrefix);

    default String sendCommand(DeviceCommand command) {
        return sendCommand(command.command(), command.expectedResponsePrefix());
    }

    /**
     * Fire-and-forget status query. Skipped if the stream is closed or a command is in flight.
     */
    void requestStatus();

    ConnectionState getConnectionState();

    /**
     * Registers a listener receiving every line from the device, on the thread that received it.
     */
    void addMessageListener(Consumer<DeviceResponse> listener);

    void setStatusCallback(Consumer<ConnectionState> callback);

    /**
     * Closes the stream for good; no further reconnects are attempted.
     */
    void close();
}

package at.sv.lights.device;

/**
 * Diagnostic snapshot of the serial connection.
 *
 * @param reconnectAttempts the number of re-open attempts since the stream was last open
 */
public record ConnectionState(boolean open, String portName, String lastMessage, int reconnectAttempts) {
}

package at.sv.lights.device;

import java.io.IOException;

/**
 * A line oriented byte stream to the device, e.g. a serial port.
 */
public interface DeviceStream {

    /**
     * Opens the stream. Received lines, errors and the stream being closed are reported to the given listener,
     * possibly on a thread owned by the stream.
     */
    void open(DeviceStreamListener listener) throws IOException;

    /**
     * Writes the given line followed by the line terminator.
     */
    void writeLine(String line) throws IOException;

    void close();

    boolean isOpen();

    String getName();
}

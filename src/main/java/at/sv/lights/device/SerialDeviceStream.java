package at.sv.lights.device;

import com.fazecast.jSerialComm.SerialPort;
import com.fazecast.jSerialComm.SerialPortEvent;
import com.fazecast.jSerialComm.SerialPortMessageListener;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

@Slf4j
public final class SerialDeviceStream implements DeviceStream {

    private static final byte[] RESPONSE_DELIMITER = "\r\n".getBytes(StandardCharsets.US_ASCII);
    private static final String COMMAND_TERMINATOR = "\n";

    private final String portPath;
    private final int baudRate;

    private volatile SerialPort port;

    public SerialDeviceStream(String portPath, int baudRate) {
        this.portPath = portPath;
        this.baudRate = baudRate;
    }

    @Override
    public void open(DeviceStreamListener listener) throws IOException {
        SerialPort serialPort = SerialPort.getCommPort(portPath);
        serialPort.setComPortParameters(baudRate, 8, SerialPort.ONE_STOP_BIT, SerialPort.NO_PARITY);
        if (!serialPort.openPort()) {
            throw new IOException("Failed to open serial port " + portPath + " (error code " + serialPort.getLastErrorCode() + ")");
        }
        serialPort.addDataListener(new LineListener(listener));
        port = serialPort;
    }

    @Override
    public void writeLine(String line) throws IOException {
        SerialPort serialPort = port;
        if (serialPort == null || !serialPort.isOpen()) {
            throw new IOException("Serial port " + portPath + " is not open");
        }
        byte[] bytes = (line + COMMAND_TERMINATOR).getBytes(StandardCharsets.US_ASCII);
        int written = serialPort.writeBytes(bytes, bytes.length);
        if (written != bytes.length) {
            throw new IOException("Wrote " + written + " of " + bytes.length + " bytes to " + portPath +
                                  " (error code " + serialPort.getLastErrorCode() + ")");
        }
    }

    @Override
    public void close() {
        SerialPort serialPort = port;
        port = null;
        if (serialPort != null) {
            serialPort.removeDataListener();
            serialPort.closePort();
        }
    }

    @Override
    public boolean isOpen() {
        SerialPort serialPort = port;
        return serialPort != null && serialPort.isOpen();
    }

    @Override
    public String getName() {
        return portPath;
    }

    private static final class LineListener implements SerialPortMessageListener {

        private final DeviceStreamListener listener;

        private LineListener(DeviceStreamListener listener) {
            this.listener = listener;
        }

        @Override
        public int getListeningEvents() {
            return SerialPort.LISTENING_EVENT_DATA_RECEIVED | SerialPort.LISTENING_EVENT_PORT_DISCONNECTED;
        }

        @Override
        public byte[] getMessageDelimiter() {
            return RESPONSE_DELIMITER;
        }

        @Override
        public boolean delimiterIndicatesEndOfMessage() {
            return true;
        }

        @Override
        public void serialEvent(SerialPortEvent event) {
            if (event.getEventType() == SerialPort.LISTENING_EVENT_PORT_DISCONNECTED) {
                listener.onClosed();
                return;
            }
            byte[] data = event.getReceivedData();
            if (data != null) {
                listener.onLine(new String(data, StandardCharsets.US_ASCII));
            }
        }
    }
}

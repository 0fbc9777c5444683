package at.sv.lights.device;

public final class DeviceResponseParser {

    private static final String ERROR_PREFIX = "Error:";

    private final DeviceStatusParser statusParser;

    public DeviceResponseParser(int channelCount) {
        this.statusParser = new DeviceStatusParser(channelCount);
    }

    public DeviceResponse parse(String line) {
        if (line.startsWith(ERROR_PREFIX)) {
            return new DeviceResponse.DeviceError(line);
        }
        if (line.startsWith("STATUS;")) {
            return new DeviceResponse.StatusReport(line, statusParser.parse(line));
        }
        if (line.startsWith("POWER;")) {
            return new DeviceResponse.PowerReport(line);
        }
        if (line.startsWith("INFO:")) {
            return new DeviceResponse.Info(line);
        }
        if (line.startsWith("CMD:") || line.startsWith("ACK:") || line.startsWith("PIR ")) {
            return new DeviceResponse.Acknowledgement(line);
        }
        return new DeviceResponse.Unrecognized(line);
    }
}

package at.sv.lights.device;

/**
 * One command of the device's line protocol together with the prefix of the line that acknowledges it.
 * Arguments are expected to be validated by the caller, see {@link DeviceController}.
 */
public record DeviceCommand(String command, String expectedResponsePrefix) {

    public static DeviceCommand turnOn(int channelId) {
        return new DeviceCommand("S" + channelId + "1", "CMD: LED " + channelId + " ON persistently");
    }

    public static DeviceCommand turnOff(int channelId) {
        return new DeviceCommand("S" + channelId + "0", "CMD: LED " + channelId + " OFF persistently");
    }

    public static DeviceCommand setBrightness(int channelId, int level) {
        return new DeviceCommand("B" + channelId + ":" + level, "CMD: LED " + channelId + " brightness " + level);
    }

    public static DeviceCommand setMotionConfig(int channelId, boolean motionActive) {
        return new DeviceCommand("C" + channelId + (motionActive ? "1" : "0"), "CMD: LED " + channelId + " motion:");
    }

    public static DeviceCommand setAutoMode(int channelId) {
        return new DeviceCommand("A" + channelId, "CMD: LED " + channelId + " Auto Mode (Motion Active)");
    }

    public static DeviceCommand enableMotionSensor() {
        return new DeviceCommand("E", "PIR Enabled");
    }

    public static DeviceCommand disableMotionSensor() {
        return new DeviceCommand("D", "PIR Disabled");
    }

    public static DeviceCommand setDailySchedule(int channelId, int onHour, int onMinute, int offHour, int offMinute) {
        String command = String.format("T%d%02d%02d%02d%02d", channelId, onHour, onMinute, offHour, offMinute);
        return new DeviceCommand(command, "ACK: Daily schedule set for LED");
    }

    public static DeviceCommand clearSchedules() {
        return new DeviceCommand("C", "ACK: schedules cleared");
    }

    public static DeviceCommand resetEnergyCounters() {
        return new DeviceCommand("R", "ACK: Energy counters reset");
    }

    public static DeviceCommand queryStatus() {
        return new DeviceCommand("Q", "STATUS;");
    }
}

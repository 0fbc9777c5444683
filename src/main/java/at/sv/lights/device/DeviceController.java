package at.sv.lights.device;

import at.sv.lights.StateScheduler;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Typed operations on top of the raw command channel. Validates arguments, refreshes the cached device status
 * after state changes and whenever the device announces a change on its own.
 */
@Slf4j
public final class DeviceController {

    static final int MAX_BRIGHTNESS = 255;
    static final Duration STATE_CHANGE_REFRESH_DELAY = Duration.ofMillis(100);
    static final Duration INFO_REFRESH_DELAY = Duration.ofMillis(200);

    private final DeviceCommandChannel channel;
    private final DeviceStatusParser statusParser;
    private final StateScheduler stateScheduler;
    private final Supplier<ZonedDateTime> currentTime;
    private final int channelCount;

    private volatile DeviceStatus currentStatus;

    public DeviceController(DeviceCommandChannel channel, StateScheduler stateScheduler,
                            Supplier<ZonedDateTime> currentTime, int channelCount) {
        this.channel = channel;
        this.statusParser = new DeviceStatusParser(channelCount);
        this.stateScheduler = stateScheduler;
        this.currentTime = currentTime;
        this.channelCount = channelCount;
        channel.addMessageListener(this::handleMessage);
    }

    public String turnOn(int channelId) {
        assertValidChannel(channelId);
        return sendStateChange(DeviceCommand.turnOn(channelId));
    }

    public String turnOff(int channelId) {
        assertValidChannel(channelId);
        return sendStateChange(DeviceCommand.turnOff(channelId));
    }

    public String setBrightness(int channelId, int level) {
        assertValidChannel(channelId);
        if (level < 0 || level > MAX_BRIGHTNESS) {
            throw new InvalidCommandArgument("Invalid brightness " + level + ". Must be between 0 and " + MAX_BRIGHTNESS + ".");
        }
        return sendStateChange(DeviceCommand.setBrightness(channelId, level));
    }

    public String setMotionConfig(int channelId, boolean motionActive) {
        assertValidChannel(channelId);
        return sendStateChange(DeviceCommand.setMotionConfig(channelId, motionActive));
    }

    public String setAutoMode(int channelId) {
        assertValidChannel(channelId);
        return sendStateChange(DeviceCommand.setAutoMode(channelId));
    }

    public String enableMotionSensor() {
        return sendStateChange(DeviceCommand.enableMotionSensor());
    }

    public String disableMotionSensor() {
        return sendStateChange(DeviceCommand.disableMotionSensor());
    }

    /**
     * Programs the device's own daily timer for the given channel. Independent of the scheduled jobs.
     */
    public String setDailySchedule(int channelId, int onHour, int onMinute, int offHour, int offMinute) {
        assertValidChannel(channelId);
        assertValidTime(onHour, onMinute);
        assertValidTime(offHour, offMinute);
        return sendStateChange(DeviceCommand.setDailySchedule(channelId, onHour, onMinute, offHour, offMinute));
    }

    public String clearSchedules() {
        return sendStateChange(DeviceCommand.clearSchedules());
    }

    public String resetEnergyCounters() {
        return sendStateChange(DeviceCommand.resetEnergyCounters());
    }

    /**
     * Queries the device and returns the freshly parsed status.
     */
    public DeviceStatus getStatus() {
        String line = channel.sendCommand(DeviceCommand.queryStatus());
        DeviceStatus status = statusParser.parse(line);
        currentStatus = status;
        return status;
    }

    public ChannelStatus getChannelStatus(int channelId) {
        assertValidChannel(channelId);
        return getStatus().channel(channelId);
    }

    /**
     * @return the status of the last {@code STATUS;} line seen, without talking to the device
     */
    public Optional<DeviceStatus> getCurrentStatus() {
        return Optional.ofNullable(currentStatus);
    }

    public ConnectionState getConnectionState() {
        return channel.getConnectionState();
    }

    public int getChannelCount() {
        return channelCount;
    }

    private String sendStateChange(DeviceCommand command) {
        String response = channel.sendCommand(command);
        scheduleStatusRefresh(STATE_CHANGE_REFRESH_DELAY);
        return response;
    }

    private void handleMessage(DeviceResponse response) {
        if (response instanceof DeviceResponse.StatusReport report) {
            currentStatus = report.status();
        } else if (response instanceof DeviceResponse.Info) {
            log.debug("Device info '{}', refreshing status", response.text());
            scheduleStatusRefresh(INFO_REFRESH_DELAY);
        }
    }

    private void scheduleStatusRefresh(Duration delay) {
        stateScheduler.schedule(channel::requestStatus, currentTime.get().plus(delay));
    }

    private void assertValidChannel(int channelId) {
        if (channelId < 0 || channelId >= channelCount) {
            throw new InvalidCommandArgument("Invalid channel id " + channelId + ". Must be between 0 and " + (channelCount - 1) + ".");
        }
    }

    private static void assertValidTime(int hour, int minute) {
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new InvalidCommandArgument(String.format("Invalid time %02d:%02d", hour, minute));
        }
    }
}

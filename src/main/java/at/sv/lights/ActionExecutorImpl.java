package at.sv.lights;

import at.sv.lights.device.DeviceController;
import at.sv.lights.device.DeviceFailure;
import at.sv.lights.device.InvalidCommandArgument;
import at.sv.lights.persistence.EventLog;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.ZonedDateTime;
import java.util.function.Supplier;

@Slf4j
public final class ActionExecutorImpl implements ActionExecutor {

    private final DeviceController deviceController;
    private final EventLog eventLog;
    private final Supplier<ZonedDateTime> currentTime;

    public ActionExecutorImpl(DeviceController deviceController, EventLog eventLog, Supplier<ZonedDateTime> currentTime) {
        this.deviceController = deviceController;
        this.eventLog = eventLog;
        this.currentTime = currentTime;
    }

    @Override
    public String execute(long scheduleId, int channelId, ChannelAction action, ExecutionPath path) {
        MDC.put("context", "channel-" + channelId);
        try {
            String response = action == ChannelAction.ON ? deviceController.turnOn(channelId) : deviceController.turnOff(channelId);
            log.info("Turned {} channel {} for schedule {} via {}: {}", action, channelId, scheduleId, path.label(), response);
            append(EventLogEntry.success(scheduleId, channelId, action, response, currentTime.get().toInstant(), path));
            return response;
        } catch (DeviceFailure | InvalidCommandArgument e) {
            log.error("Failed to turn {} channel {} for schedule {} via {}: {}", action, channelId, scheduleId,
                    path.label(), e.getMessage());
            append(EventLogEntry.failure(scheduleId, channelId, action, e.getMessage(), currentTime.get().toInstant(), path));
            throw new ActionExecutionFailure("Failed to turn " + action + " channel " + channelId + " for schedule " + scheduleId, e);
        }
    }

    private void append(EventLogEntry entry) {
        try {
            eventLog.append(entry);
        } catch (Exception e) {
            log.warn("Failed to record event {}: {}", entry, e.getMessage());
        }
    }
}

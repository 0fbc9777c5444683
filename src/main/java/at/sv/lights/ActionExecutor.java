package at.sv.lights;

/**
 * Performs a single ON/OFF action on the device and records the outcome in the event log.
 */
public interface ActionExecutor {
    /**
     * @return the device's acknowledgement
     * @throws ActionExecutionFailure if the device could not be driven; the failure is already logged as an
     *                                error event
     */
    String execute(long scheduleId, int channelId, ChannelAction action, ExecutionPath path);
}

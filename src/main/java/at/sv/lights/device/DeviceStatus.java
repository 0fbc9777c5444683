package at.sv.lights.device;

import java.util.List;

public record DeviceStatus(boolean motionSensorEnabled, List<ChannelStatus> channels) {

    public DeviceStatus {
        channels = List.copyOf(channels);
    }

    public ChannelStatus channel(int channelId) {
        return channels.stream()
                       .filter(status -> status.getId() == channelId)
                       .findFirst()
                       .orElseThrow(() -> new InvalidCommandArgument("Unknown channel " + channelId));
    }
}

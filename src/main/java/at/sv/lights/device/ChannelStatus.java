package at.sv.lights.device;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@AllArgsConstructor
public final class ChannelStatus {
    private final int id;
    private final boolean motionActive;
    private final boolean manualControlActive;
    private final boolean timedScheduleActive;
    /**
     * Seconds until the on-device timed schedule switches the channel again, 0 if none is active.
     */
    private final long timedScheduleRemainingSeconds;
    private final int brightness;
    /**
     * Energy consumed today in Wh.
     */
    private final double energyToday;
    private final double currentPowerW;
}

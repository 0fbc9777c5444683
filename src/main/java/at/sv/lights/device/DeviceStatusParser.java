package at.sv.lights.device;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses status lines of the form {@code STATUS;PIR:1;LM0:1;MC0:0;TS0:0;TR0:0;B0:255;EN0:0.12;PW0:4.8;...}.
 * Unknown or malformed fields are ignored.
 */
@Slf4j
public final class DeviceStatusParser {

    static final double MAX_POWER_W = 5.0;
    private static final Pattern CHANNEL_FIELD = Pattern.compile("([A-Z]+)(\\d+)");

    private final int channelCount;

    public DeviceStatusParser(int channelCount) {
        this.channelCount = channelCount;
    }

    public DeviceStatus parse(String line) {
        boolean motionSensorEnabled = false;
        boolean powerReported = false;
        List<ChannelStatus.ChannelStatusBuilder> builders = new ArrayList<>();
        for (int i = 0; i < channelCount; i++) {
            builders.add(ChannelStatus.builder().id(i));
        }
        int[] brightness = new int[channelCount];
        String[] parts = line.trim().split(";");
        for (int i = 1; i < parts.length; i++) {
            String[] keyValue = parts[i].split(":", 2);
            if (keyValue.length != 2) {
                continue;
            }
            String key = keyValue[0];
            String value = keyValue[1];
            if (key.equals("PIR")) {
                motionSensorEnabled = value.equals("1");
                continue;
            }
            Matcher matcher = CHANNEL_FIELD.matcher(key);
            if (!matcher.matches()) {
                continue;
            }
            try {
                int index = Integer.parseInt(matcher.group(2));
                if (index >= channelCount) {
                    log.trace("Ignoring status field '{}' for unknown channel", parts[i]);
                    continue;
                }
                ChannelStatus.ChannelStatusBuilder builder = builders.get(index);
                switch (matcher.group(1)) {
                    case "LM" -> builder.motionActive(value.equals("1"));
                    case "MC" -> builder.manualControlActive(value.equals("1"));
                    case "TS" -> builder.timedScheduleActive(value.equals("1"));
                    case "TR" -> builder.timedScheduleRemainingSeconds(Long.parseLong(value));
                    case "B" -> {
                        brightness[index] = Integer.parseInt(value);
                        builder.brightness(brightness[index]);
                    }
                    case "EN" -> builder.energyToday(Double.parseDouble(value));
                    case "PW" -> {
                        builder.currentPowerW(Double.parseDouble(value));
                        powerReported = true;
                    }
                    default -> log.trace("Ignoring unknown status field '{}'", parts[i]);
                }
            } catch (NumberFormatException e) {
                log.trace("Ignoring malformed status field '{}'", parts[i]);
            }
        }
        if (!powerReported) {
            for (int i = 0; i < channelCount; i++) {
                builders.get(i).currentPowerW(estimatePower(brightness[i]));
            }
        }
        List<ChannelStatus> channels = new ArrayList<>();
        builders.forEach(builder -> channels.add(builder.build()));
        return new DeviceStatus(motionSensorEnabled, channels);
    }

    private static double estimatePower(int brightness) {
        if (brightness <= 0) {
            return 0;
        }
        return MAX_POWER_W * brightness / 255.0;
    }
}

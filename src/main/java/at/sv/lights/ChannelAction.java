package at.sv.lights;

import java.util.Locale;

public enum ChannelAction {
    ON,
    OFF;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChannelAction fromLabel(String label) {
        return valueOf(label.toUpperCase(Locale.ROOT));
    }
}

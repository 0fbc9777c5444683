package at.sv.lights;

import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleDefinitionTest {

    private static ScheduleDefinition.ScheduleDefinitionBuilder valid() {
        return ScheduleDefinition.builder().id(4).channelId(1).onHour(6).onMinute(5).offHour(22).offMinute(30).active(true);
    }

    @Test
    void validate_validDefinition_passes() {
        valid().build().validate(3);
    }

    @Test
    void validate_channelOutOfRange_throws() {
        assertThatThrownBy(() -> valid().channelId(3).build().validate(3))
                .isInstanceOf(InvalidScheduleDefinition.class)
                .hasMessageContaining("invalid channel id 3");
        assertThatThrownBy(() -> valid().channelId(-1).build().validate(3))
                .isInstanceOf(InvalidScheduleDefinition.class);
    }

    @Test
    void validate_timeOutOfRange_throws() {
        assertThatThrownBy(() -> valid().onHour(24).build().validate(3)).isInstanceOf(InvalidScheduleDefinition.class);
        assertThatThrownBy(() -> valid().offMinute(60).build().validate(3))
                .isInstanceOf(InvalidScheduleDefinition.class)
                .hasMessageContaining("invalid off time");
    }

    @Test
    void timeOf_returnsActionTime() {
        ScheduleDefinition definition = valid().build();

        assertThat(definition.timeOf(ChannelAction.ON)).isEqualTo(LocalTime.of(6, 5));
        assertThat(definition.timeOf(ChannelAction.OFF)).isEqualTo(LocalTime.of(22, 30));
    }

    @Test
    void toString_isCompact() {
        assertThat(valid().active(false).build()).hasToString("{id=4, channel=1, on=06:05, off=22:30, inactive}");
    }
}

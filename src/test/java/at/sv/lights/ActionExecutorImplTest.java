package at.sv.lights;

import at.sv.lights.device.CommandTimeoutFailure;
import at.sv.lights.device.DeviceCommand;
import at.sv.lights.device.DeviceCommandChannel;
import at.sv.lights.device.DeviceController;
import at.sv.lights.persistence.EventLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ActionExecutorImplTest {

    private ZonedDateTime now;
    private DeviceCommandChannel channel;
    private EventLog eventLog;
    private ActionExecutorImpl executor;

    @BeforeEach
    void setUp() {
        now = ZonedDateTime.of(2024, 3, 1, 5, 30, 0, 0, ZoneId.of("Europe/Vienna"));
        channel = mock(DeviceCommandChannel.class);
        eventLog = mock(EventLog.class);
        DeviceController controller = new DeviceController(channel, new TestStateScheduler(), () -> now, 3);
        executor = new ActionExecutorImpl(controller, eventLog, () -> now);
    }

    @Test
    void execute_on_sendsCommand_recordsSuccess() {
        when(channel.sendCommand(DeviceCommand.turnOn(0))).thenReturn("CMD: LED 0 ON persistently");

        String response = executor.execute(1, 0, ChannelAction.ON, ExecutionPath.QUEUE);

        assertThat(response).isEqualTo("CMD: LED 0 ON persistently");
        verify(eventLog).append(new EventLogEntry(1, 0, ChannelAction.ON, true, "CMD: LED 0 ON persistently",
                now.toInstant(), ExecutionPath.QUEUE));
    }

    @Test
    void execute_off_sendsOffCommand() {
        when(channel.sendCommand(DeviceCommand.turnOff(2))).thenReturn("CMD: LED 2 OFF persistently");

        executor.execute(3, 2, ChannelAction.OFF, ExecutionPath.FALLBACK);

        verify(channel).sendCommand(DeviceCommand.turnOff(2));
        verify(eventLog).append(EventLogEntry.success(3, 2, ChannelAction.OFF, "CMD: LED 2 OFF persistently",
                now.toInstant(), ExecutionPath.FALLBACK));
    }

    @Test
    void execute_deviceFailure_recordsFailure_andThrows() {
        when(channel.sendCommand(DeviceCommand.turnOn(1))).thenThrow(new CommandTimeoutFailure("no response"));

        assertThatThrownBy(() -> executor.execute(2, 1, ChannelAction.ON, ExecutionPath.DIRECT_SWEEP))
                .isInstanceOf(ActionExecutionFailure.class)
                .hasCauseInstanceOf(CommandTimeoutFailure.class);

        verify(eventLog).append(EventLogEntry.failure(2, 1, ChannelAction.ON, "no response", now.toInstant(),
                ExecutionPath.DIRECT_SWEEP));
    }

    @Test
    void execute_invalidChannel_recordsFailure_withoutSending() {
        assertThatThrownBy(() -> executor.execute(2, 7, ChannelAction.ON, ExecutionPath.QUEUE))
                .isInstanceOf(ActionExecutionFailure.class);

        verify(channel, never()).sendCommand(any(DeviceCommand.class));
        verify(eventLog).append(any());
    }

    @Test
    void execute_failingEventLog_stillReturnsResponse() {
        when(channel.sendCommand(DeviceCommand.turnOn(0))).thenReturn("CMD: LED 0 ON persistently");
        doThrow(new UncheckedIOException(new IOException("disk full"))).when(eventLog).append(any());

        assertThat(executor.execute(1, 0, ChannelAction.ON, ExecutionPath.QUEUE)).isEqualTo("CMD: LED 0 ON persistently");
    }
}

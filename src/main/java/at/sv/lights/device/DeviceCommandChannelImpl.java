package at.sv.lights.device;

import at.sv.lights.StateScheduler;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

@Slf4j
public final class DeviceCommandChannelImpl implements DeviceCommandChannel {

    static final String INITIAL_MESSAGE = "Awaiting initial device message...";

    private final DeviceStream stream;
    private final DeviceResponseParser responseParser;
    private final StateScheduler stateScheduler;
    private final Supplier<ZonedDateTime> currentTime;
    private final Duration commandTimeout;
    private final Duration reconnectDelay;
    private final Duration statusRequestDelay;
    private final ReentrantLock writerLock = new ReentrantLock(true);
    private final List<Consumer<DeviceResponse>> messageListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean reconnectScheduled = new AtomicBoolean();
    private final AtomicInteger reconnectAttempts = new AtomicInteger();

    private volatile Consumer<ConnectionState> statusCallback = state -> {
    };
    private volatile PendingCommand pendingCommand;
    private volatile boolean open;
    private volatile boolean tornDown;
    private volatile String lastMessage = INITIAL_MESSAGE;

    public DeviceCommandChannelImpl(DeviceStream stream, DeviceResponseParser responseParser,
                                    StateScheduler stateScheduler, Supplier<ZonedDateTime> currentTime,
                                    Duration commandTimeout, Duration reconnectDelay, Duration statusRequestDelay) {
        this.stream = stream;
        this.responseParser = responseParser;
        this.stateScheduler = stateScheduler;
        this.currentTime = currentTime;
        this.commandTimeout = commandTimeout;
        this.reconnectDelay = reconnectDelay;
        this.statusRequestDelay = statusRequestDelay;
    }

    @Override
    public void open() {
        if (tornDown) {
            return;
        }
        MDC.put("context", "device");
        log.info("Opening serial port {}...", stream.getName());
        try {
            stream.open(new StreamListener());
        } catch (IOException e) {
            handleStreamFailure("Serial port error: " + e.getMessage());
            return;
        }
        open = true;
        reconnectAttempts.set(0);
        lastMessage = "Serial port opened, waiting for device...";
        log.info("Serial port {} opened.", stream.getName());
        notifyStatus();
        stateScheduler.schedule(this::requestStatus, currentTime.get().plus(statusRequestDelay));
    }

    @Override
    public String sendCommand(String command, String expectedResponsePrefix) {
        assertOpen(command);
        writerLock.lock();
        try {
            assertOpen(command);
            PendingCommand pending = new PendingCommand(command, expectedResponsePrefix);
            pendingCommand = pending;
            write(command);
            log.debug("Sent '{}', waiting for '{}'", command, expectedResponsePrefix);
            return pending.await();
        } finally {
            pendingCommand = null;
            writerLock.unlock();
        }
    }

    private void assertOpen(String command) {
        if (!open) {
            throw new ChannelNotOpenFailure("Serial port " + stream.getName() + " not open, cannot send '" + command +
                                            "'. Last message: " + lastMessage);
        }
    }

    private void write(String command) {
        try {
            stream.writeLine(command);
        } catch (IOException e) {
            throw new DeviceWriteFailure("Failed to write '" + command + "' to serial port: " + e.getMessage(), e);
        }
    }

    @Override
    public void requestStatus() {
        if (!open) {
            log.debug("Serial port not open, skipping status request.");
            return;
        }
        if (!writerLock.tryLock()) {
            log.debug("Command in flight, skipping status request.");
            return;
        }
        try {
            stream.writeLine(DeviceCommand.queryStatus().command());
            log.trace("Sent status query.");
        } catch (IOException e) {
            log.warn("Failed to write status query: {}", e.getMessage());
        } finally {
            writerLock.unlock();
        }
    }

    @Override
    public ConnectionState getConnectionState() {
        return new ConnectionState(open, stream.getName(), lastMessage, reconnectAttempts.get());
    }

    @Override
    public void addMessageListener(Consumer<DeviceResponse> listener) {
        messageListeners.add(listener);
    }

    @Override
    public void setStatusCallback(Consumer<ConnectionState> callback) {
        statusCallback = callback;
    }

    @Override
    public void close() {
        tornDown = true;
        open = false;
        stream.close();
        lastMessage = "Serial port closed.";
        PendingCommand pending = pendingCommand;
        if (pending != null) {
            pending.fail(new ChannelNotOpenFailure("Serial port closed while waiting for response to '" + pending.command + "'"));
        }
        log.info("Serial port {} closed.", stream.getName());
        notifyStatus();
    }

    private void handleLine(String line) {
        String message = line.trim();
        if (message.isEmpty()) {
            return;
        }
        lastMessage = message;
        log.trace("Device: {}", message);
        DeviceResponse response;
        try {
            response = responseParser.parse(message);
        } catch (RuntimeException e) {
            log.warn("Failed to parse device message '{}': {}", message, e.getLocalizedMessage());
            response = new DeviceResponse.Unrecognized(message);
        }
        PendingCommand pending = pendingCommand;
        if (pending != null) {
            pending.offer(response);
        }
        for (Consumer<DeviceResponse> listener : messageListeners) {
            try {
                listener.accept(response);
            } catch (Exception e) {
                log.error("Message listener failed for '{}': {}", message, e.getLocalizedMessage(), e);
            }
        }
    }

    private void handleStreamFailure(String message) {
        if (tornDown) {
            return;
        }
        open = false;
        lastMessage = message;
        log.warn("Serial port {}: {}", stream.getName(), message);
        PendingCommand pending = pendingCommand;
        if (pending != null) {
            pending.fail(new ChannelNotOpenFailure("Serial port failed while waiting for response to '" +
                                                   pending.command + "': " + message));
        }
        notifyStatus();
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (!reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        int attempt = reconnectAttempts.incrementAndGet();
        log.info("Reopening serial port {} in {}s (attempt {})", stream.getName(), reconnectDelay.toSeconds(), attempt);
        stateScheduler.schedule(this::reopen, currentTime.get().plus(reconnectDelay));
    }

    private void reopen() {
        reconnectScheduled.set(false);
        if (tornDown) {
            return;
        }
        stream.close();
        open();
    }

    private void notifyStatus() {
        try {
            statusCallback.accept(getConnectionState());
        } catch (Exception e) {
            log.error("Status callback failed: {}", e.getLocalizedMessage(), e);
        }
    }

    private final class StreamListener implements DeviceStreamListener {
        @Override
        public void onLine(String line) {
            handleLine(line);
        }

        @Override
        public void onError(Throwable error) {
            handleStreamFailure("Serial port error: " + error.getMessage());
        }

        @Override
        public void onClosed() {
            handleStreamFailure("Serial port closed unexpectedly.");
        }
    }

    private final class PendingCommand {
        private final String command;
        private final String expectedPrefix;
        private final CompletableFuture<String> response = new CompletableFuture<>();

        private PendingCommand(String command, String expectedPrefix) {
            this.command = command;
            this.expectedPrefix = expectedPrefix;
        }

        private void offer(DeviceResponse deviceResponse) {
            if (deviceResponse.text().startsWith(expectedPrefix)) {
                response.complete(deviceResponse.text());
            } else if (deviceResponse instanceof DeviceResponse.DeviceError) {
                response.completeExceptionally(new DeviceReportedFailure("Device reported error for '" + command +
                                                                         "': " + deviceResponse.text()));
            }
        }

        private void fail(DeviceFailure failure) {
            response.completeExceptionally(failure);
        }

        private String await() {
            try {
                return response.get(commandTimeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                throw new CommandTimeoutFailure("No response starting with '" + expectedPrefix + "' for '" + command +
                                                "' within " + commandTimeout.toMillis() + "ms. Last message: " + lastMessage);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof DeviceFailure failure) {
                    throw failure;
                }
                throw new DeviceFailure("Command '" + command + "' failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CommandTimeoutFailure("Interrupted while waiting for response to '" + command + "'");
            }
        }
    }
}

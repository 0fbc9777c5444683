package at.sv.lights;

import at.sv.lights.device.DeviceCommandChannel;
import at.sv.lights.device.DeviceCommandChannelImpl;
import at.sv.lights.device.DeviceController;
import at.sv.lights.device.DeviceResponseParser;
import at.sv.lights.device.SerialDeviceStream;
import at.sv.lights.persistence.JsonFileScheduleRepository;
import at.sv.lights.persistence.JsonLinesEventLog;
import at.sv.lights.queue.DualBackendScheduler;
import at.sv.lights.queue.DurableQueueScheduler;
import at.sv.lights.queue.FallbackTimerScheduler;
import at.sv.lights.queue.RedisJobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

@Command(name = "LightScheduler", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false)
public final class LightScheduler implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(LightScheduler.class);
    static final String DISABLED_PORT = "DISABLED";
    /**
     * Channel ids are sent as a single digit.
     */
    static final int MAX_CHANNEL_COUNT = 10;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(
            index = "0",
            paramLabel = "SERIAL_PORT",
            defaultValue = "${env:SERIAL_PORT}",
            description = "The serial port the lighting controller is attached to, e.g. /dev/ttyACM0 or COM3. " +
                          "Use '" + DISABLED_PORT + "' to run without a device.")
    String serialPort;
    @Parameters(
            index = "1",
            paramLabel = "SCHEDULES_FILE",
            defaultValue = "${env:SCHEDULES_FILE}",
            description = "The JSON file containing the schedule definitions.")
    Path schedulesFile;
    @Option(names = "--baud-rate", paramLabel = "<baud>",
            defaultValue = "${env:BAUD_RATE:-9600}",
            description = "The baud rate of the serial connection. Default: ${DEFAULT-VALUE}")
    int baudRate;
    @Option(names = "--channel-count", paramLabel = "<count>",
            defaultValue = "${env:CHANNEL_COUNT:-3}",
            description = "The number of lighting channels of the device. Default: ${DEFAULT-VALUE}")
    int channelCount;
    @Option(names = "--command-timeout", paramLabel = "<timeout>",
            defaultValue = "${env:COMMAND_TIMEOUT:-7000}",
            description = "The time in ms to wait for the device to acknowledge a command. Default: ${DEFAULT-VALUE} ms.")
    int commandTimeoutInMs;
    @Option(names = "--reconnect-delay", paramLabel = "<delay>",
            defaultValue = "${env:RECONNECT_DELAY:-5000}",
            description = "The delay in ms before the serial port is reopened after it failed. Default: ${DEFAULT-VALUE} ms.")
    int reconnectDelayInMs;
    @Option(names = "--status-request-delay", paramLabel = "<delay>",
            defaultValue = "${env:STATUS_REQUEST_DELAY:-1000}",
            description = "The delay in ms after opening the serial port before the first status is requested. " +
                          "Default: ${DEFAULT-VALUE} ms.")
    int statusRequestDelayInMs;
    @Option(names = "--redis-host", paramLabel = "<host>",
            defaultValue = "${env:REDIS_HOST:-localhost}",
            description = "The host of the Redis server used for the durable job queues. Default: ${DEFAULT-VALUE}")
    String redisHost;
    @Option(names = "--redis-port", paramLabel = "<port>",
            defaultValue = "${env:REDIS_PORT:-6379}",
            description = "The port of the Redis server. Default: ${DEFAULT-VALUE}")
    int redisPort;
    @Option(names = "--redis-password", paramLabel = "<password>",
            defaultValue = "${env:REDIS_PASSWORD}",
            description = "The optional password of the Redis server.")
    String redisPassword;
    @Option(names = "--disable-durable-backend",
            defaultValue = "${env:DISABLE_DURABLE_BACKEND:-false}",
            description = "Only use in-process timers. Scheduled jobs are then lost on restart until the next " +
                          "reconciliation. Default: ${DEFAULT-VALUE}")
    boolean disableDurableBackend;
    @Option(names = "--event-log-file", paramLabel = "<file>",
            defaultValue = "${env:EVENT_LOG_FILE:-events.jsonl}",
            description = "The file executed actions are appended to, one JSON object per line. Default: ${DEFAULT-VALUE}")
    Path eventLogFile;
    @Option(names = "--startup-reconcile-delay", paramLabel = "<delay>",
            defaultValue = "${env:STARTUP_RECONCILE_DELAY:-10}",
            description = "The delay in seconds after startup before the schedules are applied for the first time. " +
                          "Default: ${DEFAULT-VALUE} seconds.")
    int startupReconcileDelayInSeconds;

    public static void main(String[] args) {
        int execute = new CommandLine(new LightScheduler()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        MDC.put("context", "init");
        assertConfigurationParameters();
        assertInputIsReadable();

        Supplier<ZonedDateTime> currentTime = ZonedDateTime::now;
        StateSchedulerImpl stateScheduler = new StateSchedulerImpl(Executors.newSingleThreadScheduledExecutor(), currentTime);

        DeviceCommandChannel channel = new DeviceCommandChannelImpl(
                new SerialDeviceStream(serialPort, baudRate), new DeviceResponseParser(channelCount),
                stateScheduler, currentTime, Duration.ofMillis(commandTimeoutInMs), Duration.ofMillis(reconnectDelayInMs),
                Duration.ofMillis(statusRequestDelayInMs));
        channel.setStatusCallback(state -> LOG.info("Device connection: {}", state.open() ? "open" : state.lastMessage()));
        DeviceController deviceController = new DeviceController(channel, stateScheduler, currentTime, channelCount);
        ActionExecutor executor = new ActionExecutorImpl(deviceController, new JsonLinesEventLog(eventLogFile), currentTime);

        LettuceConnectionFactory connectionFactory = createRedisConnectionFactory();
        DurableQueueScheduler durable = null;
        if (connectionFactory != null) {
            RedisJobStore jobStore = new RedisJobStore(new StringRedisTemplate(connectionFactory), connectionFactory);
            durable = new DurableQueueScheduler(jobStore, executor, currentTime);
        }
        DualBackendScheduler scheduler = new DualBackendScheduler(durable,
                new FallbackTimerScheduler(stateScheduler, executor, currentTime), stateScheduler);
        ScheduleReconciler reconciler = new ScheduleReconciler(new JsonFileScheduleRepository(schedulesFile), scheduler,
                executor, stateScheduler, currentTime, channelCount);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutting down.");
            stateScheduler.shutdown();
            channel.close();
            if (connectionFactory != null) {
                connectionFactory.destroy();
            }
        }));

        if (DISABLED_PORT.equalsIgnoreCase(serialPort)) {
            LOG.warn("Serial port disabled, actions will be logged as failed.");
        } else {
            channel.open();
        }
        scheduler.start();
        reconciler.start(Duration.ofSeconds(startupReconcileDelayInSeconds));
        LOG.info("Started with {} channel(s), schedules from '{}'.", channelCount, schedulesFile.toAbsolutePath());
    }

    private LettuceConnectionFactory createRedisConnectionFactory() {
        if (disableDurableBackend) {
            LOG.info("Durable backend disabled.");
            return null;
        }
        RedisStandaloneConfiguration configuration = new RedisStandaloneConfiguration(redisHost, redisPort);
        if (redisPassword != null && !redisPassword.isBlank()) {
            configuration.setPassword(RedisPassword.of(redisPassword));
        }
        LettuceClientConfiguration clientConfiguration = LettuceClientConfiguration.builder()
                                                                                   .commandTimeout(Duration.ofSeconds(2))
                                                                                   .build();
        LettuceConnectionFactory connectionFactory = new LettuceConnectionFactory(configuration, clientConfiguration);
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        return connectionFactory;
    }

    private void assertConfigurationParameters() {
        assertDeviceConfigurations();
        assertRedisConfigurations();
        assertTimingConfigurations();
    }

    private void assertDeviceConfigurations() {
        if (serialPort == null || serialPort.isBlank()) {
            fail("SERIAL_PORT must be set");
        }
        if (baudRate <= 0) {
            fail("--baud-rate must be > 0");
        }
        if (channelCount < 1 || channelCount > MAX_CHANNEL_COUNT) {
            fail("--channel-count must be within [1," + MAX_CHANNEL_COUNT + "]");
        }
    }

    private void assertRedisConfigurations() {
        if (disableDurableBackend) {
            return;
        }
        if (redisHost == null || redisHost.isBlank()) {
            fail("--redis-host must be non-empty unless --disable-durable-backend is set");
        }
        if (redisPort < 1 || redisPort > 65535) {
            fail("--redis-port must be within [1,65535]");
        }
    }

    private void assertTimingConfigurations() {
        if (commandTimeoutInMs <= 0) {
            fail("--command-timeout must be > 0");
        }
        if (reconnectDelayInMs <= 0) {
            fail("--reconnect-delay must be > 0");
        }
        if (statusRequestDelayInMs < 0) {
            fail("--status-request-delay must be >= 0");
        }
        if (startupReconcileDelayInSeconds < 0) {
            fail("--startup-reconcile-delay must be >= 0");
        }
    }

    private void assertInputIsReadable() {
        if (schedulesFile == null) {
            fail("SCHEDULES_FILE must be set");
        }
        if (!Files.isReadable(schedulesFile)) {
            fail("Given schedules file '" + schedulesFile.toAbsolutePath() + "' does not exist or is not readable!");
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }
}

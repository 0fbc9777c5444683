package at.sv.lights;

import at.sv.lights.persistence.ScheduleRepository;
import at.sv.lights.queue.ActionScheduler;
import at.sv.lights.time.NextOccurrenceCalculator;
import at.sv.lights.time.ScheduleOccurrences;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Turns the stored schedule definitions into scheduled jobs, at startup and every midnight. Additionally runs a
 * minute sweep that executes actions whose time of day matches the current minute, independent of the job
 * backends.
 */
@Slf4j
public final class ScheduleReconciler {

    static final long SWEEP_INTERVAL_MS = TimeUnit.MINUTES.toMillis(1);

    private final ScheduleRepository repository;
    private final ActionScheduler scheduler;
    private final ActionExecutor executor;
    private final StateScheduler stateScheduler;
    private final Supplier<ZonedDateTime> currentTime;
    private final NextOccurrenceCalculator occurrenceCalculator;
    private final int channelCount;

    private LocalDateTime lastSweptMinute;

    public ScheduleReconciler(ScheduleRepository repository, ActionScheduler scheduler, ActionExecutor executor,
                              StateScheduler stateScheduler, Supplier<ZonedDateTime> currentTime, int channelCount) {
        this.repository = repository;
        this.scheduler = scheduler;
        this.executor = executor;
        this.stateScheduler = stateScheduler;
        this.currentTime = currentTime;
        this.occurrenceCalculator = new NextOccurrenceCalculator();
        this.channelCount = channelCount;
    }

    /**
     * Schedules the first reconciliation after the given delay, the daily one at midnight and the minute sweep.
     */
    public void start(Duration startupDelay) {
        ZonedDateTime now = currentTime.get();
        log.info("Reconciling schedules in {}s", startupDelay.toSeconds());
        stateScheduler.schedule(this::reconcileAll, now.plus(startupDelay));
        scheduleDailyReconciliation();
        long untilNextMinute = Duration.between(now, now.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1)).toMillis();
        stateScheduler.scheduleAtFixedRate(this::sweepDueSchedules, untilNextMinute, SWEEP_INTERVAL_MS, TimeUnit.MILLISECONDS);
    }

    private void scheduleDailyReconciliation() {
        ZonedDateTime now = currentTime.get();
        ZonedDateTime midnight = ZonedDateTime.of(now.toLocalDate().plusDays(1), LocalTime.MIDNIGHT, now.getZone());
        stateScheduler.schedule(() -> {
            try {
                reconcileAll();
            } finally {
                scheduleDailyReconciliation();
            }
        }, midnight);
    }

    /**
     * Replaces all scheduled jobs with the next ON and OFF occurrence of every valid active definition.
     * Invalid definitions are skipped.
     */
    public synchronized List<ReconciledSchedule> reconcileAll() {
        MDC.put("context", "reconcile");
        List<ScheduleDefinition> definitions = repository.listActiveSchedules();
        scheduler.cancelAll();
        ZonedDateTime now = currentTime.get();
        List<ReconciledSchedule> reconciled = new ArrayList<>();
        for (ScheduleDefinition definition : definitions) {
            try {
                definition.validate(channelCount);
            } catch (InvalidScheduleDefinition e) {
                log.warn("Skipping invalid schedule: {}", e.getMessage());
                continue;
            }
            ScheduleOccurrences occurrences = occurrenceCalculator.nextOccurrences(definition.onTime(), definition.offTime(), now);
            long onTimestamp = occurrences.on().toInstant().toEpochMilli();
            long offTimestamp = occurrences.off().toInstant().toEpochMilli();
            scheduler.scheduleAction(definition.channelId(), definition.id(), ChannelAction.ON, onTimestamp);
            scheduler.scheduleAction(definition.channelId(), definition.id(), ChannelAction.OFF, offTimestamp);
            updateLastApplied(definition, now);
            reconciled.add(new ReconciledSchedule(definition.id(), definition.channelId(), onTimestamp, offTimestamp));
            log.info("Schedule {}: next ON {}, next OFF {}", definition, occurrences.on(), occurrences.off());
        }
        log.info("Reconciled {} of {} active schedule(s)", reconciled.size(), definitions.size());
        return reconciled;
    }

    /**
     * Executes every action whose time of day equals the current minute. Each minute is swept at most once.
     */
    public synchronized void sweepDueSchedules() {
        ZonedDateTime now = currentTime.get();
        LocalDateTime minute = now.toLocalDateTime().truncatedTo(ChronoUnit.MINUTES);
        if (minute.equals(lastSweptMinute)) {
            return;
        }
        lastSweptMinute = minute;
        MDC.put("context", "sweep");
        for (ScheduleDefinition definition : repository.listActiveSchedules()) {
            try {
                definition.validate(channelCount);
            } catch (InvalidScheduleDefinition e) {
                log.trace("Ignoring invalid schedule: {}", e.getMessage());
                continue;
            }
            for (ChannelAction action : ChannelAction.values()) {
                LocalTime time = definition.timeOf(action);
                if (time.getHour() == now.getHour() && time.getMinute() == now.getMinute()) {
                    executeDirectly(definition, action, now);
                }
            }
        }
    }

    private void executeDirectly(ScheduleDefinition definition, ChannelAction action, ZonedDateTime now) {
        log.info("Schedule {} due now, turning {} channel {} directly", definition.id(), action, definition.channelId());
        try {
            executor.execute(definition.id(), definition.channelId(), action, ExecutionPath.DIRECT_SWEEP);
            updateLastApplied(definition, now);
        } catch (ActionExecutionFailure e) {
            log.warn("Direct execution of schedule {} failed: {}", definition.id(), e.getMessage());
        }
    }

    private void updateLastApplied(ScheduleDefinition definition, ZonedDateTime now) {
        try {
            repository.updateLastApplied(definition.id(), now.toInstant());
        } catch (RuntimeException e) {
            log.warn("Failed to update last applied timestamp of schedule {}: {}", definition.id(), e.getMessage());
        }
    }
}

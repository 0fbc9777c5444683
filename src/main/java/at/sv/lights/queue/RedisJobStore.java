package at.sv.lights.queue;

import at.sv.lights.ChannelAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Stores jobs in two Redis queues, {@code lights:on-jobs} and {@code lights:off-jobs}. Each queue has one sorted
 * set per {@link JobState} (scored by due time) and one hash per job holding its fields.
 */
@Slf4j
public final class RedisJobStore implements JobStore {

    static final String KEY_PREFIX = "lights:";
    private static final List<JobState> STORED_STATES = List.of(JobState.DELAYED, JobState.WAITING, JobState.ACTIVE);

    private final StringRedisTemplate redisTemplate;
    private final LettuceConnectionFactory connectionFactory;

    public RedisJobStore(StringRedisTemplate redisTemplate, LettuceConnectionFactory connectionFactory) {
        this.redisTemplate = redisTemplate;
        this.connectionFactory = connectionFactory;
    }

    @Override
    public void save(ScheduledJob job) {
        String queue = queueName(job.getKey().action());
        String id = job.getKey().id();
        execute("save " + id, () -> {
            redisTemplate.opsForHash().putAll(jobKey(queue, id), toHash(job));
            for (JobState state : STORED_STATES) {
                if (state != job.getState()) {
                    redisTemplate.opsForZSet().remove(stateKey(queue, state), id);
                }
            }
            redisTemplate.opsForZSet().add(stateKey(queue, job.getState()), id, score(job));
            return null;
        });
    }

    @Override
    public Optional<ScheduledJob> find(JobKey key) {
        String queue = queueName(key.action());
        return execute("find " + key, () -> read(queue, key.id()));
    }

    @Override
    public List<ScheduledJob> findByState(JobState state) {
        return execute("list " + state, () -> {
            List<ScheduledJob> jobs = new ArrayList<>();
            for (ChannelAction action : ChannelAction.values()) {
                String queue = queueName(action);
                Set<String> ids = redisTemplate.opsForZSet().range(stateKey(queue, state), 0, -1);
                if (ids == null) {
                    continue;
                }
                for (String id : ids) {
                    read(queue, id).ifPresentOrElse(jobs::add,
                            () -> log.warn("Job {} listed as {} but has no data, ignoring", id, state));
                }
            }
            jobs.sort(Comparator.comparingLong(ScheduledJob::getDueTimestamp));
            return jobs;
        });
    }

    @Override
    public boolean remove(JobKey key) {
        String queue = queueName(key.action());
        String id = key.id();
        return execute("remove " + id, () -> {
            for (JobState state : STORED_STATES) {
                redisTemplate.opsForZSet().remove(stateKey(queue, state), id);
            }
            return Boolean.TRUE.equals(redisTemplate.delete(jobKey(queue, id)));
        });
    }

    @Override
    public void removeAll() {
        execute("remove all jobs", () -> {
            List<String> keys = new ArrayList<>();
            for (ChannelAction action : ChannelAction.values()) {
                String queue = queueName(action);
                for (JobState state : STORED_STATES) {
                    String stateKey = stateKey(queue, state);
                    Set<String> ids = redisTemplate.opsForZSet().range(stateKey, 0, -1);
                    if (ids != null) {
                        ids.forEach(id -> keys.add(jobKey(queue, id)));
                    }
                    keys.add(stateKey);
                }
            }
            Long deleted = redisTemplate.delete(keys);
            log.debug("Removed {} Redis key(s)", deleted);
            return null;
        });
    }

    @Override
    public Map<JobState, Long> countByState() {
        return execute("count jobs", () -> {
            Map<JobState, Long> counts = new EnumMap<>(JobState.class);
            for (JobState state : STORED_STATES) {
                long count = 0;
                for (ChannelAction action : ChannelAction.values()) {
                    Long size = redisTemplate.opsForZSet().zCard(stateKey(queueName(action), state));
                    count += size != null ? size : 0;
                }
                counts.put(state, count);
            }
            return counts;
        });
    }

    @Override
    public void ping() {
        String reply = execute("ping", () -> redisTemplate.execute((RedisCallback<String>) RedisConnection::ping));
        log.trace("Redis ping: {}", reply);
    }

    @Override
    public void reconnect() {
        execute("reconnect", () -> {
            connectionFactory.resetConnection();
            return null;
        });
    }

    private Optional<ScheduledJob> read(String queue, String id) {
        Map<Object, Object> fields = redisTemplate.opsForHash().entries(jobKey(queue, id));
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(fromHash(id, fields));
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new BackendUnavailableFailure("Redis operation '" + operation + "' failed: " + e.getMessage(), e);
        }
    }

    static String queueName(ChannelAction action) {
        return KEY_PREFIX + action.label() + "-jobs";
    }

    static String stateKey(String queue, JobState state) {
        return queue + ":" + state.name().toLowerCase(Locale.ROOT);
    }

    static String jobKey(String queue, String id) {
        return queue + ":job:" + id;
    }

    private static double score(ScheduledJob job) {
        if (job.getState() == JobState.ACTIVE && job.getActivatedAt() != null) {
            return job.getActivatedAt();
        }
        return job.getDueTimestamp();
    }

    private static Map<String, String> toHash(ScheduledJob job) {
        Map<String, String> fields = new HashMap<>();
        fields.put("targetTimestamp", Long.toString(job.getTargetTimestamp()));
        fields.put("attemptsRemaining", Integer.toString(job.getAttemptsRemaining()));
        fields.put("state", job.getState().name());
        fields.put("activatedAt", job.getActivatedAt() == null ? "" : job.getActivatedAt().toString());
        fields.put("retryAt", job.getRetryAt() == null ? "" : job.getRetryAt().toString());
        return fields;
    }

    private static ScheduledJob fromHash(String id, Map<Object, Object> fields) {
        return ScheduledJob.builder()
                           .key(JobKey.parse(id))
                           .targetTimestamp(Long.parseLong((String) fields.get("targetTimestamp")))
                           .attemptsRemaining(Integer.parseInt((String) fields.get("attemptsRemaining")))
                           .state(JobState.valueOf((String) fields.get("state")))
                           .activatedAt(parseOptionalLong(fields.get("activatedAt")))
                           .retryAt(parseOptionalLong(fields.get("retryAt")))
                           .build();
    }

    private static Long parseOptionalLong(Object value) {
        if (value == null || ((String) value).isEmpty()) {
            return null;
        }
        return Long.parseLong((String) value);
    }
}

package at.sv.lights.queue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Job store keeping copies of the jobs in memory. Can simulate an unreachable backend.
 */
final class InMemoryJobStore implements JobStore {

    private final Map<JobKey, ScheduledJob> jobs = new LinkedHashMap<>();
    private boolean available = true;
    private int reconnectCount;

    void setAvailable(boolean available) {
        this.available = available;
    }

    int getReconnectCount() {
        return reconnectCount;
    }

    int size() {
        return jobs.size();
    }

    @Override
    public void save(ScheduledJob job) {
        assertAvailable();
        jobs.put(job.getKey(), job.toBuilder().build());
    }

    @Override
    public Optional<ScheduledJob> find(JobKey key) {
        assertAvailable();
        return Optional.ofNullable(jobs.get(key)).map(job -> job.toBuilder().build());
    }

    @Override
    public List<ScheduledJob> findByState(JobState state) {
        assertAvailable();
        List<ScheduledJob> result = new ArrayList<>();
        for (ScheduledJob job : jobs.values()) {
            if (job.getState() == state) {
                result.add(job.toBuilder().build());
            }
        }
        result.sort(Comparator.comparingLong(ScheduledJob::getDueTimestamp));
        return result;
    }

    @Override
    public boolean remove(JobKey key) {
        assertAvailable();
        return jobs.remove(key) != null;
    }

    @Override
    public void removeAll() {
        assertAvailable();
        jobs.clear();
    }

    @Override
    public Map<JobState, Long> countByState() {
        assertAvailable();
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        jobs.values().forEach(job -> counts.merge(job.getState(), 1L, Long::sum));
        return counts;
    }

    @Override
    public void ping() {
        assertAvailable();
    }

    @Override
    public void reconnect() {
        reconnectCount++;
    }

    private void assertAvailable() {
        if (!available) {
            throw new BackendUnavailableFailure("Connection refused", null);
        }
    }
}

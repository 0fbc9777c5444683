package at.sv.lights.queue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent storage of the durable queue. Every operation may throw {@link BackendUnavailableFailure}.
 */
public interface JobStore {

    /**
     * Stores the job, moving it to the set of its current state.
     */
    void save(ScheduledJob job);

    Optional<ScheduledJob> find(JobKey key);

    /**
     * @return the jobs in the given state ordered by due time
     */
    List<ScheduledJob> findByState(JobState state);

    boolean remove(JobKey key);

    void removeAll();

    Map<JobState, Long> countByState();

    void ping();

    /**
     * Drops the current connection so the next operation connects anew.
     */
    void reconnect();
}

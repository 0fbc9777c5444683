package at.sv.lights.queue;

import at.sv.lights.ChannelAction;

import java.util.List;

/**
 * Fires single ON/OFF actions at a given point in time.
 */
public interface ActionScheduler {

    /**
     * Submits a job for the given action, replacing any pending job with the same {@link JobKey}.
     *
     * @param targetTimestamp epoch millis; past or near timestamps are executed right away
     */
    JobHandle scheduleAction(int channelId, long scheduleId, ChannelAction action, long targetTimestamp);

    /**
     * @return true if a pending job was removed
     */
    boolean cancelAction(JobKey key);

    List<PendingJob> listPendingJobs();

    void cancelAll();
}

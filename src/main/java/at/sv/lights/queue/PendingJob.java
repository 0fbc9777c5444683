package at.sv.lights.queue;

public record PendingJob(JobKey key, long targetTimestamp, JobState state) {
}

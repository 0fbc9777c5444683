package at.sv.lights.queue;

/**
 * The action of a job has run, but the job could not be removed from the durable store afterwards. The job
 * must not be handed to another backend, and its stale copy has to be removed once the store is back.
 */
public final class ExecutedJobRemovalFailure extends BackendUnavailableFailure {

    private final JobKey key;

    public ExecutedJobRemovalFailure(JobKey key, BackendUnavailableFailure cause) {
        super("Executed job " + key + " could not be removed: " + cause.getMessage(), cause);
        this.key = key;
    }

    public JobKey getKey() {
        return key;
    }
}

package at.sv.lights.queue;

/**
 * The durable job store could not be reached. Never surfaces outside the scheduler façade.
 */
public class BackendUnavailableFailure extends RuntimeException {
    public BackendUnavailableFailure(String message, Throwable cause) {
        super(message, cause);
    }
}

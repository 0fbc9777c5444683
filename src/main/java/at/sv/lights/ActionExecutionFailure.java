package at.sv.lights;

public final class ActionExecutionFailure extends RuntimeException {
    public ActionExecutionFailure(String message, Throwable cause) {
        super(message, cause);
    }
}

package cpusched.Exception;

/**
 * Malformed task fields. Raised at registration, never during a run.
 */
public class InvalidInputException extends SchedulingException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, String taskId) {
        super(message, taskId);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}

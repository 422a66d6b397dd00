package cpusched.Exception;

/**
 * Unfinished tasks remain but nothing can ever become ready again.
 * Fatal to the run that raised it.
 */
public class DeadlockException extends SchedulingException {

    public DeadlockException(String message, String taskId, int time) {
        super(message, taskId, time);
    }
}

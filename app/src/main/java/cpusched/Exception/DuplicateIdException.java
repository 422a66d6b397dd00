package cpusched.Exception;

public class DuplicateIdException extends SchedulingException {

    public DuplicateIdException(String taskId) {
        super("Task id already registered: " + taskId, taskId);
    }
}

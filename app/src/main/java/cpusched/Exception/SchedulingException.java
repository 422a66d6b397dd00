package cpusched.Exception;

/**
 * Base class for every error the scheduling engine reports.
 * Carries the offending task id and the simulated time when they are known.
 */
public class SchedulingException extends Exception {
    private final String taskId;
    private final Integer time;

    public SchedulingException(String message) {
        this(message, null, null);
    }

    public SchedulingException(String message, String taskId) {
        this(message, taskId, null);
    }

    public SchedulingException(String message, String taskId, Integer time) {
        super(message);
        this.taskId = taskId;
        this.time = time;
    }

    public SchedulingException(String message, Throwable cause) {
        super(message, cause);
        this.taskId = null;
        this.time = null;
    }

    /**
     * @return id of the task involved, or null
     */
    public String getTaskId() {
        return taskId;
    }

    /**
     * @return simulated time of the failure, or null when raised outside a run
     */
    public Integer getTime() {
        return time;
    }
}

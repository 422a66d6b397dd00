package cpusched.Exception;

/**
 * Invalid policy parameters or an unsatisfiable dependency graph,
 * detected before the first simulation step.
 */
public class ConfigurationException extends SchedulingException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, String taskId) {
        super(message, taskId);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

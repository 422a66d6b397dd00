package cpusched.Exception;

public class EmptyInputException extends SchedulingException {

    public EmptyInputException(String message) {
        super(message);
    }
}

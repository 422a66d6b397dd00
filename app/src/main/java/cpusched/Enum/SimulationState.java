package cpusched.Enum;

public enum SimulationState {
    NOT_STARTED,
    RUNNING,
    IDLE,
    FINISHED
}

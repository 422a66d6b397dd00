package cpusched.kernel.scheduler;

import cpusched.kernel.process.Task;

/**
 * A scheduler's answer: run this task for this many time units.
 * Quantum slices are kept as separate Gantt segments even when the same task
 * is dispatched again right away.
 */
public final class Decision {
    private final Task task;
    private final int duration;
    private final boolean quantumSlice;

    private Decision(Task task, int duration, boolean quantumSlice) {
        if (duration <= 0) {
            throw new IllegalArgumentException("Decision duration must be positive: " + duration);
        }
        this.task = task;
        this.duration = duration;
        this.quantumSlice = quantumSlice;
    }

    public static Decision run(Task task, int duration) {
        return new Decision(task, duration, false);
    }

    public static Decision slice(Task task, int duration) {
        return new Decision(task, duration, true);
    }

    public Task getTask() {
        return task;
    }

    public String getTaskId() {
        return task.getId();
    }

    public int getDuration() {
        return duration;
    }

    public boolean isQuantumSlice() {
        return quantumSlice;
    }

    @Override
    public String toString() {
        return "run " + task.getId() + " for " + duration + (quantumSlice ? " (slice)" : "");
    }
}

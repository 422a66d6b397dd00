package cpusched.kernel.process;

/**
 * Mutable per-run bookkeeping for one task.
 * Owned by the simulation loop for the duration of a single run.
 */
public class TaskRunState {
    private final Task task;

    private int remainingTime;
    private Integer startTime;
    private Integer finishTime;
    private Integer lastRanAt;

    // Multilevel feedback queue level (0 = top)
    private int queueLevel;

    public TaskRunState(Task task) {
        this.task = task;
        reset();
    }

    /**
     * Restore the state a task has before it is ever dispatched.
     */
    public void reset() {
        remainingTime = task.getBurstTime();
        startTime = null;
        finishTime = null;
        lastRanAt = null;
        queueLevel = 0;
    }

    /**
     * Account for {@code duration} units of CPU time starting at {@code startedAt}.
     *
     * @return true if the task finished with this slice
     */
    public boolean execute(int startedAt, int duration) {
        if (duration <= 0 || duration > remainingTime) {
            throw new IllegalStateException("Task " + task.getId() + " cannot run for " + duration
                    + " with " + remainingTime + " remaining");
        }
        if (startTime == null) {
            startTime = startedAt;
        }
        remainingTime -= duration;
        lastRanAt = startedAt + duration;
        if (remainingTime == 0) {
            finishTime = lastRanAt;
            return true;
        }
        return false;
    }

    public Task getTask() {
        return task;
    }

    public int getRemainingTime() {
        return remainingTime;
    }

    public Integer getStartTime() {
        return startTime;
    }

    public Integer getFinishTime() {
        return finishTime;
    }

    /**
     * End of the task's most recent slice, or null if it never ran.
     */
    public Integer getLastRanAt() {
        return lastRanAt;
    }

    public boolean isStarted() {
        return startTime != null;
    }

    public boolean isFinished() {
        return finishTime != null;
    }

    public int getQueueLevel() {
        return queueLevel;
    }

    public void setQueueLevel(int queueLevel) {
        this.queueLevel = queueLevel;
    }
}

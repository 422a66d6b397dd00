package cpusched.metrics;

/**
 * Per-task figures derived from a finished timeline.
 */
public class TaskMetrics {
    public final String taskId;
    public final int arrivalTime;
    public final int burstTime;
    public final int priority;
    public final int startTime;
    public final int finishTime;

    public TaskMetrics(String taskId, int arrivalTime, int burstTime, int priority, int startTime, int finishTime) {
        this.taskId = taskId;
        this.arrivalTime = arrivalTime;
        this.burstTime = burstTime;
        this.priority = priority;
        this.startTime = startTime;
        this.finishTime = finishTime;
    }

    public int getTurnaroundTime() {
        return finishTime - arrivalTime;
    }

    public int getWaitingTime() {
        return getTurnaroundTime() - burstTime;
    }

    /**
     * Delay between arrival and the first dispatch.
     */
    public int getResponseTime() {
        return startTime - arrivalTime;
    }

    @Override
    public String toString() {
        return String.format("%s start=%d finish=%d waiting=%d turnaround=%d",
                taskId, startTime, finishTime, getWaitingTime(), getTurnaroundTime());
    }
}

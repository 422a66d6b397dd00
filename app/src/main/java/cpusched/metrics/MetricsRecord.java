package cpusched.metrics;

import java.util.Collections;
import java.util.List;

/**
 * Per-task rows plus the aggregate figures of one simulation run.
 * cpuUtilization is a fraction in [0, 1].
 */
public class MetricsRecord {
    private final List<TaskMetrics> tasks;
    private final double averageWaitingTime;
    private final double averageTurnaroundTime;
    private final double averageResponseTime;
    private final double cpuUtilization;
    private final double throughput;
    private final int busyTime;
    private final int elapsedTime;
    private final int makespan;
    private final int contextSwitches;

    public MetricsRecord(List<TaskMetrics> tasks, double averageWaitingTime, double averageTurnaroundTime,
            double averageResponseTime, double cpuUtilization, double throughput, int busyTime, int elapsedTime,
            int makespan, int contextSwitches) {
        this.tasks = Collections.unmodifiableList(tasks);
        this.averageWaitingTime = averageWaitingTime;
        this.averageTurnaroundTime = averageTurnaroundTime;
        this.averageResponseTime = averageResponseTime;
        this.cpuUtilization = cpuUtilization;
        this.throughput = throughput;
        this.busyTime = busyTime;
        this.elapsedTime = elapsedTime;
        this.makespan = makespan;
        this.contextSwitches = contextSwitches;
    }

    public List<TaskMetrics> getTasks() {
        return tasks;
    }

    public TaskMetrics getTask(String taskId) {
        for (TaskMetrics metrics : tasks) {
            if (metrics.taskId.equals(taskId)) {
                return metrics;
            }
        }
        return null;
    }

    public double getAverageWaitingTime() {
        return averageWaitingTime;
    }

    public double getAverageTurnaroundTime() {
        return averageTurnaroundTime;
    }

    public double getAverageResponseTime() {
        return averageResponseTime;
    }

    public double getCpuUtilization() {
        return cpuUtilization;
    }

    public double getThroughput() {
        return throughput;
    }

    public int getBusyTime() {
        return busyTime;
    }

    /**
     * Last finish time minus earliest arrival; 0 for a single task, which
     * also makes utilization and throughput 0.
     */
    public int getElapsedTime() {
        return elapsedTime;
    }

    public int getMakespan() {
        return makespan;
    }

    public int getContextSwitches() {
        return contextSwitches;
    }

    @Override
    public String toString() {
        return String.format("Avg Waiting Time: %.2f%nAvg Turnaround Time: %.2f%nAvg Response Time: %.2f%n"
                + "CPU Utilization: %.2f%%%nThroughput: %.4f",
                averageWaitingTime, averageTurnaroundTime, averageResponseTime, cpuUtilization * 100, throughput);
    }
}

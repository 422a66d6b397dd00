package cpusched.metrics;

import cpusched.Exception.EmptyInputException;
import cpusched.kernel.GanttSegment;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives waiting, turnaround, utilization and throughput from a finished
 * timeline. Reads the registry's task facts only; never touches run-state.
 */
public final class MetricsCalculator {

    private MetricsCalculator() {
    }

    /**
     * @throws EmptyInputException   if the registry holds no tasks
     * @throws IllegalStateException if a task's segments do not add up to its burst
     */
    public static MetricsRecord calculate(TaskRegistry registry, List<GanttSegment> segments)
            throws EmptyInputException {
        if (registry.isEmpty()) {
            throw new EmptyInputException("Cannot compute metrics for an empty workload");
        }

        Map<String, Integer> executed = new HashMap<>();
        Map<String, Integer> firstStart = new HashMap<>();
        Map<String, Integer> lastEnd = new HashMap<>();
        int busy = 0;
        int makespan = 0;
        int switches = 0;
        String previous = null;
        for (GanttSegment segment : segments) {
            makespan = Math.max(makespan, segment.getEnd());
            if (segment.isIdle()) {
                continue;
            }
            String id = segment.getTaskId();
            busy += segment.getDuration();
            executed.merge(id, segment.getDuration(), Integer::sum);
            firstStart.putIfAbsent(id, segment.getStart());
            lastEnd.put(id, segment.getEnd());
            if (previous != null && !previous.equals(id)) {
                switches++;
            }
            previous = id;
        }

        List<TaskMetrics> rows = new ArrayList<>();
        int earliestArrival = Integer.MAX_VALUE;
        int lastFinish = 0;
        long totalWaiting = 0;
        long totalTurnaround = 0;
        long totalResponse = 0;
        for (Task task : registry.getTasks()) {
            int ran = executed.getOrDefault(task.getId(), 0);
            if (ran != task.getBurstTime()) {
                throw new IllegalStateException("Task " + task.getId() + " ran for " + ran
                        + " of its " + task.getBurstTime() + " burst");
            }
            TaskMetrics row = new TaskMetrics(task.getId(), task.getArrivalTime(), task.getBurstTime(),
                    task.getPriority(), firstStart.get(task.getId()), lastEnd.get(task.getId()));
            rows.add(row);
            totalWaiting += row.getWaitingTime();
            totalTurnaround += row.getTurnaroundTime();
            totalResponse += row.getResponseTime();
            earliestArrival = Math.min(earliestArrival, task.getArrivalTime());
            lastFinish = Math.max(lastFinish, row.finishTime);
        }

        int count = rows.size();
        // a single task has no span to measure rates over
        int elapsed = count > 1 ? lastFinish - earliestArrival : 0;
        double utilization = elapsed > 0 ? (double) busy / elapsed : 0.0;
        double throughput = elapsed > 0 ? (double) count / elapsed : 0.0;
        return new MetricsRecord(rows,
                (double) totalWaiting / count,
                (double) totalTurnaround / count,
                (double) totalResponse / count,
                utilization, throughput, busy, elapsed, makespan, switches);
    }
}

package cpusched.kernel.scheduler;

import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Helpers for the FIFO-queue policies (round robin and feedback queues).
 */
abstract class QueueingScheduler extends Scheduler {
    protected final int quantum;

    protected QueueingScheduler(int quantum) {
        if (quantum <= 0) {
            throw new IllegalArgumentException("quantum must be > 0");
        }
        this.quantum = quantum;
    }

    /**
     * Ready tasks not yet in any queue, excluding the task that just ran,
     * ordered by the instant they became ready and then by id.
     */
    protected static List<Task> newcomers(List<Task> ready, RunState state) {
        Task interrupted = state.getInterruptedTask();
        List<Task> fresh = new ArrayList<>();
        for (Task task : ready) {
            if (task != interrupted && !state.isQueued(task.getId())) {
                fresh.add(task);
            }
        }
        fresh.sort(Comparator.comparingInt((Task t) -> state.readyAt(t).orElse(t.getArrivalTime()))
                .thenComparing(BY_ID));
        return fresh;
    }
}

package cpusched.kernel.scheduler;

import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

import java.util.Deque;
import java.util.List;

/**
 * Round-robin scheduler implementation
 * Tasks are dispatched from a FIFO queue for at most one quantum each.
 * <p>
 * A task whose quantum expires goes back behind every task that became ready
 * during its slice, including one that became ready exactly at expiry.
 */
public class RoundRobinScheduler extends QueueingScheduler {

    public RoundRobinScheduler(int quantum) {
        super(quantum);
    }

    @Override
    protected Decision select(int time, List<Task> ready, RunState state) {
        Deque<String> readyQueue = state.getReadyQueue();
        for (Task task : newcomers(ready, state)) {
            readyQueue.offer(task.getId());
        }
        Task interrupted = state.getInterruptedTask();
        if (interrupted != null && !readyQueue.contains(interrupted.getId())) {
            readyQueue.offer(interrupted.getId());
        }

        // Get the next task from the head of the queue (FIFO)
        Task next = state.getRegistry().get(readyQueue.poll());
        return Decision.slice(next, Math.min(quantum, state.remainingTime(next)));
    }

    @Override
    public String getName() {
        return "Round Robin (q=" + quantum + ")";
    }
}

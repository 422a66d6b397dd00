package cpusched.kernel.scheduler;

import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRunState;

import java.util.Deque;
import java.util.List;

/**
 * Multilevel feedback queue.
 * <p>
 * Level {@code i} hands out slices of {@code quantum * 2^i}. Newly ready
 * tasks enter level 0, a task that uses its whole slice drops one level, and
 * the bottom level behaves as plain round robin. The highest non-empty level
 * is always served first; a running slice is never cut short by an arrival.
 */
public class MultilevelFeedbackScheduler extends QueueingScheduler {
    private final int levels;

    public MultilevelFeedbackScheduler(int quantum, int levels) {
        super(quantum);
        if (levels <= 0) {
            throw new IllegalArgumentException("levels must be > 0");
        }
        this.levels = levels;
    }

    @Override
    protected Decision select(int time, List<Task> ready, RunState state) {
        List<Deque<String>> queues = state.getLevelQueues();
        for (Task task : newcomers(ready, state)) {
            state.runStateOf(task).setQueueLevel(0);
            queues.get(0).offer(task.getId());
        }

        Task interrupted = state.getInterruptedTask();
        if (interrupted != null && !state.isQueued(interrupted.getId())) {
            TaskRunState rs = state.runStateOf(interrupted);
            int level = Math.min(rs.getQueueLevel() + 1, levels - 1);
            rs.setQueueLevel(level);
            queues.get(level).offer(interrupted.getId());
        }

        for (int level = 0; level < levels; level++) {
            String id = queues.get(level).poll();
            if (id != null) {
                Task next = state.getRegistry().get(id);
                return Decision.slice(next, Math.min(quantumFor(level), state.remainingTime(next)));
            }
        }
        throw new IllegalStateException("Feedback queues empty with " + ready.size() + " ready tasks at t=" + time);
    }

    public int quantumFor(int level) {
        return quantum << level;
    }

    @Override
    public String getName() {
        return "MLFQ (" + levels + " levels, q=" + quantum + ")";
    }
}

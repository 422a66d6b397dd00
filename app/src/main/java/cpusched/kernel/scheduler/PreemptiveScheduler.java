package cpusched.kernel.scheduler;

import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

import java.util.List;

/**
 * Event-driven preemptive selection shared by SRTF and preemptive priority.
 * <p>
 * Decisions are re-evaluated at every arrival and completion. The interrupted
 * task keeps the CPU unless a ready task is strictly better by
 * {@link #compareKey}; otherwise the best task wins, ties by id.
 */
public abstract class PreemptiveScheduler extends Scheduler {

    /**
     * Negative if {@code a} should run before {@code b}, ignoring ids.
     */
    protected abstract int compareKey(Task a, Task b, RunState state);

    @Override
    protected Decision select(int time, List<Task> ready, RunState state) {
        Task best = ready.get(0);
        for (Task candidate : ready) {
            if (compareKey(candidate, best, state) < 0) {
                best = candidate;
            }
        }

        Task current = state.getInterruptedTask();
        if (current != null && ready.contains(current) && compareKey(best, current, state) >= 0) {
            best = current;
        }
        return Decision.run(best, untilNextArrival(time, best, state));
    }
}

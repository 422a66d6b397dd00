package cpusched.kernel.scheduler;

import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

import java.util.Comparator;
import java.util.List;
import java.util.OptionalInt;

/**
 * Abstract base class for all schedulers
 * Defines the decision contract every scheduling algorithm implements
 */
public abstract class Scheduler {

    /**
     * Final tie-break for every policy: ascending task id.
     */
    protected static final Comparator<Task> BY_ID = Task.BY_ID;

    // Statistics
    private int totalDecisions = 0;
    private int contextSwitches = 0;
    private int preemptions = 0;
    private String lastTaskId = null;

    /**
     * Pick the next task to run and for how long.
     *
     * @param time  current simulated time
     * @param ready tasks eligible to run, ascending by id, never empty
     * @param state run-state of the current simulation
     * @return the dispatch decision
     */
    public final Decision decide(int time, List<Task> ready, RunState state) {
        if (ready.isEmpty()) {
            throw new IllegalArgumentException("decide() called with an empty ready set at t=" + time);
        }
        Task interrupted = state.getInterruptedTask();
        Decision decision = select(time, ready, state);

        totalDecisions++;
        if (lastTaskId != null && !lastTaskId.equals(decision.getTaskId())) {
            contextSwitches++;
            if (interrupted != null) {
                preemptions++;
            }
        }
        lastTaskId = decision.getTaskId();
        return decision;
    }

    /**
     * Policy-specific selection. The ready list is sorted by id.
     */
    protected abstract Decision select(int time, List<Task> ready, RunState state);

    /**
     * Human readable algorithm name
     */
    public abstract String getName();

    /**
     * Get scheduler statistics
     *
     * @return counters for the decisions made so far
     */
    public SchedulerStats getStats() {
        return new SchedulerStats(totalDecisions, contextSwitches, preemptions, getName());
    }

    /**
     * Longest a preemptive policy may run {@code task} before the next
     * arrival forces a re-evaluation.
     */
    protected static int untilNextArrival(int time, Task task, RunState state) {
        int remaining = state.remainingTime(task);
        OptionalInt next = state.nextArrivalAfter(time);
        return next.isPresent() ? Math.min(remaining, next.getAsInt() - time) : remaining;
    }
}

package cpusched.kernel.scheduler;

import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Non-preemptive shortest job first: the smallest burst runs to completion.
 */
public class ShortestJobFirstScheduler extends Scheduler {
    private static final Comparator<Task> ORDER = Comparator.comparingInt(Task::getBurstTime).thenComparing(BY_ID);

    @Override
    protected Decision select(int time, List<Task> ready, RunState state) {
        Task next = Collections.min(ready, ORDER);
        return Decision.run(next, state.remainingTime(next));
    }

    @Override
    public String getName() {
        return "SJF (NP)";
    }
}

package cpusched.kernel.scheduler;

import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * First come, first served. Non-preemptive: the earliest arrival runs to
 * completion.
 */
public class FcfsScheduler extends Scheduler {
    private static final Comparator<Task> ORDER = Comparator.comparingInt(Task::getArrivalTime).thenComparing(BY_ID);

    @Override
    protected Decision select(int time, List<Task> ready, RunState state) {
        Task next = Collections.min(ready, ORDER);
        return Decision.run(next, state.remainingTime(next));
    }

    @Override
    public String getName() {
        return "FCFS";
    }
}

package cpusched.kernel.scheduler;

import cpusched.Enum.PriorityOrder;
import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Non-preemptive priority scheduling.
 * The best priority runs to completion; ties go to the smallest id, then the
 * earliest arrival.
 */
public class PriorityScheduler extends Scheduler {
    private final Comparator<Task> comparator;

    public PriorityScheduler(PriorityOrder order) {
        this.comparator = Comparator.comparing(Task::getPriority, order.bestFirst())
                .thenComparing(BY_ID)
                .thenComparingInt(Task::getArrivalTime);
    }

    @Override
    protected Decision select(int time, List<Task> ready, RunState state) {
        Task next = Collections.min(ready, comparator);
        return Decision.run(next, state.remainingTime(next));
    }

    @Override
    public String getName() {
        return "Priority (NP)";
    }
}

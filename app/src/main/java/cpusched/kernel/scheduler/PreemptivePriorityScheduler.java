package cpusched.kernel.scheduler;

import cpusched.Enum.PriorityOrder;
import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

/**
 * Preemptive priority: an arrival with strictly better priority takes the CPU
 * at its arrival instant.
 */
public class PreemptivePriorityScheduler extends PreemptiveScheduler {
    private final PriorityOrder order;

    public PreemptivePriorityScheduler() {
        this(PriorityOrder.LOWER_IS_HIGHER);
    }

    public PreemptivePriorityScheduler(PriorityOrder order) {
        this.order = order;
    }

    @Override
    protected int compareKey(Task a, Task b, RunState state) {
        return order.bestFirst().compare(a.getPriority(), b.getPriority());
    }

    @Override
    public String getName() {
        return "Priority (P)";
    }
}

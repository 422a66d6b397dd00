package cpusched.kernel.scheduler;

import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

/**
 * Preemptive SJF (shortest remaining time first).
 */
public class ShortestRemainingTimeScheduler extends PreemptiveScheduler {

    @Override
    protected int compareKey(Task a, Task b, RunState state) {
        return Integer.compare(state.remainingTime(a), state.remainingTime(b));
    }

    @Override
    public String getName() {
        return "SJF (P)";
    }
}

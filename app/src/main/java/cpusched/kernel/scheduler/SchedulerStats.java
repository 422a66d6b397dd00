package cpusched.kernel.scheduler;

/**
 * Counters collected by a scheduler over one run.
 */
public class SchedulerStats {
    public final int totalDecisions;
    public final int contextSwitches;
    public final int preemptions;
    public final String algorithmName;

    public SchedulerStats(int totalDecisions, int contextSwitches, int preemptions, String algorithmName) {
        this.totalDecisions = totalDecisions;
        this.contextSwitches = contextSwitches;
        this.preemptions = preemptions;
        this.algorithmName = algorithmName;
    }

    @Override
    public String toString() {
        return String.format("%s: %d decisions, %d context switches, %d preemptions",
                algorithmName, totalDecisions, contextSwitches, preemptions);
    }
}

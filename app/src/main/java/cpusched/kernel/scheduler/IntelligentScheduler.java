package cpusched.kernel.scheduler;

import cpusched.Enum.PriorityOrder;
import cpusched.kernel.RunState;
import cpusched.kernel.process.Task;

import java.util.List;
import java.util.OptionalInt;

/**
 * Composite scoring scheduler.
 * <p>
 * Every ready task gets
 *
 * <pre>
 * score = waitWeight * wait' - burstWeight * remaining' - priorityWeight * priority'
 * </pre>
 *
 * where each primed term is normalised to [0, 1] over the current ready set
 * ({@code priority'} is 0 for the best priority). A task that has waited at
 * least {@code starvationThreshold} units gets {@link #STARVATION_BOOST} plus
 * its wait added, so the longest-starved task always wins. The highest score
 * runs; ties go to the smallest id.
 * <p>
 * Decisions are re-evaluated at every arrival, completion and whenever another
 * ready task reaches the starvation threshold.
 */
public class IntelligentScheduler extends Scheduler {
    public static final double STARVATION_BOOST = 1000.0;

    private final double waitWeight;
    private final double burstWeight;
    private final double priorityWeight;
    private final int starvationThreshold;
    private final PriorityOrder order;

    public IntelligentScheduler(double waitWeight, double burstWeight, double priorityWeight,
            int starvationThreshold, PriorityOrder order) {
        if (starvationThreshold <= 0) {
            throw new IllegalArgumentException("starvationThreshold must be > 0");
        }
        this.waitWeight = waitWeight;
        this.burstWeight = burstWeight;
        this.priorityWeight = priorityWeight;
        this.starvationThreshold = starvationThreshold;
        this.order = order;
    }

    @Override
    protected Decision select(int time, List<Task> ready, RunState state) {
        int maxWait = 0;
        int maxRemaining = 0;
        int minPriority = Integer.MAX_VALUE;
        int maxPriority = Integer.MIN_VALUE;
        for (Task task : ready) {
            maxWait = Math.max(maxWait, waitOf(task, time, state));
            maxRemaining = Math.max(maxRemaining, state.remainingTime(task));
            minPriority = Math.min(minPriority, task.getPriority());
            maxPriority = Math.max(maxPriority, task.getPriority());
        }

        Task best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Task task : ready) {
            double score = score(task, time, state, maxWait, maxRemaining, minPriority, maxPriority);
            // strict comparison keeps the smallest id on ties (ready is sorted by id)
            if (best == null || score > bestScore) {
                best = task;
                bestScore = score;
            }
        }

        int duration = state.remainingTime(best);
        OptionalInt nextArrival = state.nextArrivalAfter(time);
        if (nextArrival.isPresent()) {
            duration = Math.min(duration, nextArrival.getAsInt() - time);
        }
        for (Task other : ready) {
            if (other == best) {
                continue;
            }
            int crossesAt = state.waitingSince(other) + starvationThreshold;
            if (crossesAt > time) {
                duration = Math.min(duration, crossesAt - time);
            }
        }
        return Decision.run(best, duration);
    }

    double score(Task task, int time, RunState state, int maxWait, int maxRemaining,
            int minPriority, int maxPriority) {
        int wait = waitOf(task, time, state);
        double normWait = maxWait > 0 ? (double) wait / maxWait : 0.0;
        double normRemaining = maxRemaining > 0 ? (double) state.remainingTime(task) / maxRemaining : 0.0;
        double normPriority = 0.0;
        if (maxPriority > minPriority) {
            double range = maxPriority - minPriority;
            normPriority = order == PriorityOrder.LOWER_IS_HIGHER
                    ? (task.getPriority() - minPriority) / range
                    : (maxPriority - task.getPriority()) / range;
        }

        double score = waitWeight * normWait - burstWeight * normRemaining - priorityWeight * normPriority;
        if (wait >= starvationThreshold) {
            score += STARVATION_BOOST + wait;
        }
        return score;
    }

    private static int waitOf(Task task, int time, RunState state) {
        return Math.max(0, time - state.waitingSince(task));
    }

    @Override
    public String getName() {
        return "Intelligent";
    }
}

package cpusched.kernel;

import cpusched.Enum.SimulationState;
import cpusched.Exception.ConfigurationException;
import cpusched.Exception.DeadlockException;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import cpusched.kernel.process.TaskRunState;
import cpusched.kernel.scheduler.Decision;
import cpusched.kernel.scheduler.Scheduler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalInt;

/**
 * One run of a scheduler over a registry.
 * <p>
 * Each {@link #step()} either dispatches a task for the duration chosen by the
 * scheduler or idles the CPU until the next arrival. Segments produced so far
 * always partition {@code [0, getTime()]}, so a cancelled or partially stepped
 * run still yields a consistent timeline.
 * <p>
 * Not thread-safe. The registry must not be used by another run meanwhile.
 */
public class Simulation {
    private final TaskRegistry registry;
    private final ReadinessEvaluator readiness;
    private final Scheduler scheduler;
    private final RunState runState;
    private final SimulationLog log;

    private final List<GanttSegment> segments = new ArrayList<>();
    private boolean lastWasSlice = false;
    private SimulationState state = SimulationState.NOT_STARTED;
    private volatile boolean cancelled = false;

    // No schedule can legally run past this instant
    private final long horizon;

    public Simulation(TaskRegistry registry, SimulatorConfig config, SimulationLog log)
            throws ConfigurationException {
        this(registry, config, log, true);
    }

    Simulation(TaskRegistry registry, SimulatorConfig config, SimulationLog log, boolean checkDependencies)
            throws ConfigurationException {
        config.validate();
        this.registry = registry;
        this.readiness = new ReadinessEvaluator(registry);
        if (checkDependencies) {
            readiness.validate();
        }
        this.scheduler = Simulator.createScheduler(config);
        this.log = log != null ? log : new SimulationLog();

        registry.resetRunState();
        this.runState = new RunState(registry, readiness, config);

        long latest = 0;
        for (Task task : registry.getTasks()) {
            latest = Math.max(latest, task.getArrivalTime());
        }
        long work = 0;
        for (Task task : registry.getTasks()) {
            work += task.getBurstTime();
        }
        this.horizon = latest + work;
    }

    /**
     * Advance by one decision.
     *
     * @return true if unfinished work remains
     * @throws DeadlockException if unfinished tasks can never become ready
     */
    public boolean step() throws DeadlockException {
        if (state == SimulationState.FINISHED || cancelled) {
            return false;
        }
        if (registry.allFinished()) {
            finish();
            return false;
        }

        int time = runState.getTime();
        if (time > horizon) {
            throw new DeadlockException("Simulation passed its horizon of " + horizon + " without finishing",
                    firstUnfinishedId(), time);
        }

        List<Task> ready = readiness.readySet(time);
        if (ready.isEmpty()) {
            idleUntilNextArrival(time);
            return true;
        }

        Decision decision = scheduler.decide(time, ready, runState);
        if (!ready.contains(decision.getTask())) {
            throw new IllegalStateException(scheduler.getName() + " picked " + decision.getTaskId()
                    + " which is not ready at t=" + time);
        }
        dispatch(time, decision);

        if (registry.allFinished()) {
            finish();
            return false;
        }
        return true;
    }

    /**
     * Step until every task has finished or the run is cancelled.
     */
    public void run() throws DeadlockException {
        while (step()) {
            // keep stepping
        }
    }

    /**
     * Abort between steps. Segments emitted so far stay valid.
     */
    public void cancel() {
        if (state != SimulationState.FINISHED) {
            cancelled = true;
            log.log(runState.getTime(), "Simulation cancelled");
        }
    }

    private void idleUntilNextArrival(int time) throws DeadlockException {
        OptionalInt next = readiness.nextArrivalAfter(time);
        if (next.isEmpty()) {
            String blocked = firstUnfinishedId();
            throw new DeadlockException("No task can become ready; " + blocked
                    + " waits on dependencies that never finish", blocked, time);
        }
        int until = next.getAsInt();
        segments.add(GanttSegment.idle(time, until));
        lastWasSlice = false;
        runState.setCurrentTaskId(null);
        runState.setTime(until);
        state = SimulationState.IDLE;
        log.log(time, "CPU idle until " + until);
    }

    private void dispatch(int time, Decision decision) {
        String id = decision.getTaskId();
        TaskRunState taskState = registry.getRunState(id);
        String previous = runState.getCurrentTaskId();
        boolean firstDispatch = !taskState.isStarted();
        boolean finished = taskState.execute(time, decision.getDuration());
        int end = time + decision.getDuration();

        GanttSegment last = segments.isEmpty() ? null : segments.get(segments.size() - 1);
        if (last != null && !lastWasSlice && !decision.isQuantumSlice()
                && id.equals(last.getTaskId()) && last.getEnd() == time) {
            segments.set(segments.size() - 1, last.extendTo(end));
        } else {
            segments.add(GanttSegment.run(id, time, end));
            if (previous != null && !previous.equals(id) && !registry.getRunState(previous).isFinished()) {
                log.log(time, "Preempt " + previous + " for " + id);
            }
            log.log(time, (firstDispatch ? "Dispatch " : "Resume ") + decision);
        }
        lastWasSlice = decision.isQuantumSlice();

        runState.setCurrentTaskId(id);
        runState.setTime(end);
        state = SimulationState.RUNNING;
        if (finished) {
            log.log(end, "Task " + id + " finished");
        }
    }

    private void finish() {
        state = SimulationState.FINISHED;
        log.log(runState.getTime(), "All tasks finished");
    }

    private String firstUnfinishedId() {
        List<String> ids = new ArrayList<>();
        for (TaskRunState rs : registry.getRunStates()) {
            if (!rs.isFinished()) {
                ids.add(rs.getTask().getId());
            }
        }
        ids.sort(Task.ID_ORDER);
        return ids.isEmpty() ? null : ids.get(0);
    }

    /**
     * Segments emitted so far, in time order.
     */
    public List<GanttSegment> getSegments() {
        return Collections.unmodifiableList(new ArrayList<>(segments));
    }

    public SimulationState getState() {
        return state;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isFinished() {
        return state == SimulationState.FINISHED;
    }

    public int getTime() {
        return runState.getTime();
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public RunState getRunState() {
        return runState;
    }

    public SimulationLog getLog() {
        return log;
    }
}

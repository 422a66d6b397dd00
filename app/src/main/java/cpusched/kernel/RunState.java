package cpusched.kernel;

import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import cpusched.kernel.process.TaskRunState;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.OptionalInt;

/**
 * Engine state for one run, owned by a {@link Simulation} and handed to the
 * scheduler on every decision. Queue-based policies keep their queues here so
 * that the schedulers themselves hold no per-run data besides statistics.
 */
public class RunState {
    private final TaskRegistry registry;
    private final ReadinessEvaluator readiness;

    private int time = 0;
    private String currentTaskId = null;

    // Round robin ready queue (task ids, FIFO)
    private final Deque<String> readyQueue = new ArrayDeque<>();
    // Feedback queues, index 0 is the top level
    private final List<Deque<String>> levelQueues = new ArrayList<>();

    public RunState(TaskRegistry registry, ReadinessEvaluator readiness, SimulatorConfig config) {
        this.registry = registry;
        this.readiness = readiness;
        for (int i = 0; i < config.getFeedbackLevels(); i++) {
            levelQueues.add(new ArrayDeque<>());
        }
    }

    public int getTime() {
        return time;
    }

    void setTime(int time) {
        this.time = time;
    }

    /**
     * Task dispatched by the previous decision, or null after an idle gap.
     * The task may have finished with that decision.
     */
    public String getCurrentTaskId() {
        return currentTaskId;
    }

    void setCurrentTaskId(String currentTaskId) {
        this.currentTaskId = currentTaskId;
    }

    /**
     * The previously dispatched task if it still has work left.
     */
    public Task getInterruptedTask() {
        if (currentTaskId == null) {
            return null;
        }
        TaskRunState state = registry.getRunState(currentTaskId);
        return state != null && !state.isFinished() ? state.getTask() : null;
    }

    public TaskRunState runStateOf(Task task) {
        return registry.getRunState(task.getId());
    }

    public int remainingTime(Task task) {
        return runStateOf(task).getRemainingTime();
    }

    /**
     * When the task started waiting for the CPU: the end of its last slice,
     * or the moment it became ready if it never ran.
     */
    public int waitingSince(Task task) {
        Integer lastRanAt = runStateOf(task).getLastRanAt();
        if (lastRanAt != null) {
            return lastRanAt;
        }
        return readiness.readyAt(task).orElse(time);
    }

    public OptionalInt readyAt(Task task) {
        return readiness.readyAt(task);
    }

    public OptionalInt nextArrivalAfter(int t) {
        return readiness.nextArrivalAfter(t);
    }

    public TaskRegistry getRegistry() {
        return registry;
    }

    public Deque<String> getReadyQueue() {
        return readyQueue;
    }

    public List<Deque<String>> getLevelQueues() {
        return Collections.unmodifiableList(levelQueues);
    }

    /**
     * True if the id sits in the round robin queue or any feedback level.
     */
    public boolean isQueued(String taskId) {
        if (readyQueue.contains(taskId)) {
            return true;
        }
        for (Deque<String> level : levelQueues) {
            if (level.contains(taskId)) {
                return true;
            }
        }
        return false;
    }
}

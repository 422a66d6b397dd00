package cpusched.kernel;

import cpusched.Exception.ConfigurationException;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import cpusched.kernel.process.TaskRunState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Decides which tasks may be dispatched at a given simulated time:
 * arrived, unfinished, and with every dependency finished.
 */
public class ReadinessEvaluator {
    private final TaskRegistry registry;

    public ReadinessEvaluator(TaskRegistry registry) {
        this.registry = registry;
    }

    /**
     * Tasks eligible to run at {@code time}, in ascending id order.
     */
    public List<Task> readySet(int time) {
        List<Task> ready = new ArrayList<>();
        for (Task task : registry.getTasks()) {
            if (isReady(task, time)) {
                ready.add(task);
            }
        }
        ready.sort(Task.BY_ID);
        return ready;
    }

    public boolean isReady(Task task, int time) {
        TaskRunState state = registry.getRunState(task.getId());
        if (task.getArrivalTime() > time || state.getRemainingTime() <= 0) {
            return false;
        }
        for (String dep : task.getDependencies()) {
            TaskRunState depState = registry.getRunState(dep);
            if (depState == null || !depState.isFinished() || depState.getFinishTime() > time) {
                return false;
            }
        }
        return true;
    }

    /**
     * The instant a task became (or will become) ready: the later of its
     * arrival and its dependencies' finish times. Empty while a dependency
     * is still unfinished.
     */
    public OptionalInt readyAt(Task task) {
        int readyAt = task.getArrivalTime();
        for (String dep : task.getDependencies()) {
            TaskRunState depState = registry.getRunState(dep);
            if (depState == null || !depState.isFinished()) {
                return OptionalInt.empty();
            }
            readyAt = Math.max(readyAt, depState.getFinishTime());
        }
        return OptionalInt.of(readyAt);
    }

    /**
     * Earliest arrival strictly after {@code time} among unfinished tasks.
     * Dependency unblocking only happens on a completion, which always ends
     * a dispatch, so arrivals are the only future events the loop must wake for.
     */
    public OptionalInt nextArrivalAfter(int time) {
        int next = Integer.MAX_VALUE;
        for (TaskRunState state : registry.getRunStates()) {
            int arrival = state.getTask().getArrivalTime();
            if (!state.isFinished() && arrival > time && arrival < next) {
                next = arrival;
            }
        }
        return next == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(next);
    }

    /**
     * Reject dependency graphs that could never be satisfied: references to
     * unknown ids and cycles (a task depending on itself included).
     */
    public void validate() throws ConfigurationException {
        for (Task task : registry.getTasks()) {
            for (String dep : task.getDependencies()) {
                if (!registry.contains(dep)) {
                    throw new ConfigurationException(
                            "Task " + task.getId() + " depends on unknown task " + dep, task.getId());
                }
            }
        }

        // 0 = unvisited, 1 = on the current path, 2 = done
        Map<String, Integer> marks = new HashMap<>();
        List<String> ids = new ArrayList<>();
        for (Task task : registry.getTasks()) {
            ids.add(task.getId());
        }
        ids.sort(Task.ID_ORDER);
        for (String id : ids) {
            if (marks.getOrDefault(id, 0) == 0) {
                visit(id, marks, new ArrayList<>());
            }
        }
    }

    private void visit(String id, Map<String, Integer> marks, List<String> path) throws ConfigurationException {
        marks.put(id, 1);
        path.add(id);
        for (String dep : registry.get(id).getDependencies()) {
            int mark = marks.getOrDefault(dep, 0);
            if (mark == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                throw new ConfigurationException("Dependency cycle: " + String.join(" -> ", cycle), id);
            }
            if (mark == 0) {
                visit(dep, marks, path);
            }
        }
        path.remove(path.size() - 1);
        marks.put(id, 2);
    }
}

package cpusched.kernel.process;

import cpusched.Exception.DuplicateIdException;
import cpusched.Exception.InvalidInputException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the tasks of a workload together with their run-state.
 * Not thread-safe: one simulation per registry at a time; use {@link #copy()}
 * to run the same workload concurrently.
 */
public class TaskRegistry {
    // Registration order is kept for display and export
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, TaskRunState> runStates = new LinkedHashMap<>();

    public TaskRegistry() {
    }

    public TaskRegistry(Collection<Task> initial) throws DuplicateIdException, InvalidInputException {
        for (Task task : initial) {
            add(task);
        }
    }

    /**
     * Register a task.
     *
     * @throws DuplicateIdException  if a task with the same id exists; the
     *                               registry is left unchanged
     * @throws InvalidInputException if the task is null
     */
    public void add(Task task) throws DuplicateIdException, InvalidInputException {
        if (task == null) {
            throw new InvalidInputException("Task must not be null");
        }
        if (tasks.containsKey(task.getId())) {
            throw new DuplicateIdException(task.getId());
        }
        tasks.put(task.getId(), task);
        runStates.put(task.getId(), new TaskRunState(task));
    }

    /**
     * Remove a task. Removing an unknown id is a no-op.
     *
     * @return true if a task was removed
     */
    public boolean remove(String id) {
        runStates.remove(id);
        return tasks.remove(id) != null;
    }

    public void clear() {
        tasks.clear();
        runStates.clear();
    }

    /**
     * Restore every task to its pre-run state. Must precede every run so that
     * repeated runs on the same registry are independent.
     */
    public void resetRunState() {
        for (TaskRunState state : runStates.values()) {
            state.reset();
        }
    }

    public Task get(String id) {
        return tasks.get(id);
    }

    public TaskRunState getRunState(String id) {
        return runStates.get(id);
    }

    public boolean contains(String id) {
        return tasks.containsKey(id);
    }

    /**
     * Tasks in registration order.
     */
    public List<Task> getTasks() {
        return Collections.unmodifiableList(new ArrayList<>(tasks.values()));
    }

    public Collection<TaskRunState> getRunStates() {
        return Collections.unmodifiableCollection(runStates.values());
    }

    public int size() {
        return tasks.size();
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public boolean allFinished() {
        for (TaskRunState state : runStates.values()) {
            if (!state.isFinished()) {
                return false;
            }
        }
        return true;
    }

    /**
     * An independent registry with the same tasks and fresh run-state.
     */
    public TaskRegistry copy() {
        TaskRegistry copy = new TaskRegistry();
        for (Task task : tasks.values()) {
            copy.tasks.put(task.getId(), task);
            copy.runStates.put(task.getId(), new TaskRunState(task));
        }
        return copy;
    }
}

package cpusched.kernel.process;

import cpusched.Exception.InvalidInputException;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * A simulated process: the immutable facts supplied by the user.
 * Everything that changes while a simulation runs lives in {@link TaskRunState}.
 */
public final class Task {
    /**
     * Id order used for every tie-break: runs of digits compare by numeric
     * value, so P2 sorts before P10.
     */
    public static final Comparator<String> ID_ORDER = Task::compareIds;

    /**
     * Tasks in {@link #ID_ORDER} of their ids.
     */
    public static final Comparator<Task> BY_ID = Comparator.comparing(Task::getId, ID_ORDER);

    private final String id;
    private final int arrivalTime;
    private final int burstTime;
    private final int priority;
    private final Set<String> dependencies;

    public Task(String id, int arrivalTime, int burstTime, int priority) throws InvalidInputException {
        this(id, arrivalTime, burstTime, priority, Collections.emptySet());
    }

    public Task(String id, int arrivalTime, int burstTime, int priority, Collection<String> dependencies)
            throws InvalidInputException {
        if (id == null || id.isBlank()) {
            throw new InvalidInputException("Task id must not be blank");
        }
        if (arrivalTime < 0) {
            throw new InvalidInputException("Arrival time must be >= 0, got " + arrivalTime + " for " + id, id);
        }
        if (burstTime <= 0) {
            throw new InvalidInputException("Burst time must be > 0, got " + burstTime + " for " + id, id);
        }
        this.id = id;
        this.arrivalTime = arrivalTime;
        this.burstTime = burstTime;
        this.priority = priority;

        // Sorted so that iteration order never depends on the caller's collection
        Set<String> deps = new TreeSet<>(ID_ORDER);
        if (dependencies != null) {
            for (String dep : dependencies) {
                if (dep == null || dep.isBlank()) {
                    throw new InvalidInputException("Blank dependency id on task " + id, id);
                }
                deps.add(dep);
            }
        }
        this.dependencies = Collections.unmodifiableSet(deps);
    }

    public String getId() {
        return id;
    }

    public int getArrivalTime() {
        return arrivalTime;
    }

    public int getBurstTime() {
        return burstTime;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Ids of the tasks that must finish before this one may run.
     */
    public Set<String> getDependencies() {
        return dependencies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task))
            return false;
        Task other = (Task) o;
        return arrivalTime == other.arrivalTime
                && burstTime == other.burstTime
                && priority == other.priority
                && id.equals(other.id)
                && dependencies.equals(other.dependencies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, arrivalTime, burstTime, priority, dependencies);
    }

    @Override
    public String toString() {
        return String.format("%s: Arrival=%d, Burst=%d, Priority=%d%s", id, arrivalTime, burstTime, priority,
                dependencies.isEmpty() ? "" : ", After=" + dependencies);
    }

    static int compareIds(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            char ca = a.charAt(i);
            char cb = b.charAt(j);
            if (Character.isDigit(ca) && Character.isDigit(cb)) {
                int startA = i;
                int startB = j;
                while (i < a.length() && Character.isDigit(a.charAt(i))) {
                    i++;
                }
                while (j < b.length() && Character.isDigit(b.charAt(j))) {
                    j++;
                }
                // skip leading zeros, keeping at least one digit
                while (startA < i - 1 && a.charAt(startA) == '0') {
                    startA++;
                }
                while (startB < j - 1 && b.charAt(startB) == '0') {
                    startB++;
                }
                int lengths = Integer.compare(i - startA, j - startB);
                if (lengths != 0) {
                    return lengths;
                }
                int digits = a.substring(startA, i).compareTo(b.substring(startB, j));
                if (digits != 0) {
                    return digits;
                }
            } else {
                if (ca != cb) {
                    return Character.compare(ca, cb);
                }
                i++;
                j++;
            }
        }
        int rest = Integer.compare(a.length() - i, b.length() - j);
        // P01 and P1 are different ids
        return rest != 0 ? rest : a.compareTo(b);
    }
}

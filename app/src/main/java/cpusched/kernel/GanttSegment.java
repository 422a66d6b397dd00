package cpusched.kernel;

import java.util.Objects;

/**
 * One interval of the CPU timeline: a task (or idle) occupying [start, end).
 */
public final class GanttSegment {
    public static final String IDLE_LABEL = "Idle";

    private final String taskId;
    private final int start;
    private final int end;

    private GanttSegment(String taskId, int start, int end) {
        if (end <= start) {
            throw new IllegalArgumentException("Segment end " + end + " must be after start " + start);
        }
        this.taskId = taskId;
        this.start = start;
        this.end = end;
    }

    public static GanttSegment run(String taskId, int start, int end) {
        return new GanttSegment(Objects.requireNonNull(taskId, "taskId"), start, end);
    }

    public static GanttSegment idle(int start, int end) {
        return new GanttSegment(null, start, end);
    }

    /**
     * Same segment with a later end.
     */
    GanttSegment extendTo(int newEnd) {
        return new GanttSegment(taskId, start, newEnd);
    }

    /**
     * @return the task id, or null for an idle segment
     */
    public String getTaskId() {
        return taskId;
    }

    public boolean isIdle() {
        return taskId == null;
    }

    public String getLabel() {
        return isIdle() ? IDLE_LABEL : taskId;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getDuration() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GanttSegment))
            return false;
        GanttSegment other = (GanttSegment) o;
        return start == other.start && end == other.end && Objects.equals(taskId, other.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId, start, end);
    }

    @Override
    public String toString() {
        return getLabel() + ":" + start + "-" + end;
    }
}

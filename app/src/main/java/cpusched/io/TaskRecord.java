package cpusched.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import cpusched.Exception.InvalidInputException;
import cpusched.kernel.process.Task;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of one task in a workload file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class TaskRecord {
    @JsonProperty("pid")
    private String pid;

    @JsonProperty("arrival")
    private int arrival;

    @JsonProperty("burst")
    private int burst;

    @JsonProperty("priority")
    private int priority;

    @JsonProperty("dependencies")
    private List<String> dependencies = new ArrayList<>();

    public TaskRecord() {

    }

    public static TaskRecord from(Task task) {
        TaskRecord record = new TaskRecord();
        record.setPid(task.getId());
        record.setArrival(task.getArrivalTime());
        record.setBurst(task.getBurstTime());
        record.setPriority(task.getPriority());
        record.setDependencies(new ArrayList<>(task.getDependencies()));
        return record;
    }

    public Task toTask() throws InvalidInputException {
        return new Task(pid, arrival, burst, priority, dependencies);
    }

    public String getPid() {
        return pid;
    }

    public void setPid(String pid) {
        this.pid = pid;
    }

    public int getArrival() {
        return arrival;
    }

    public void setArrival(int arrival) {
        this.arrival = arrival;
    }

    public int getBurst() {
        return burst;
    }

    public void setBurst(int burst) {
        this.burst = burst;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public List<String> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<String> dependencies) {
        this.dependencies = dependencies != null ? dependencies : new ArrayList<>();
    }
}

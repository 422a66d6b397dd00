package cpusched.kernel.scheduler;

import cpusched.kernel.GanttSegment;
import cpusched.kernel.SimulationResult;
import cpusched.kernel.Simulator;
import cpusched.kernel.SimulatorConfig;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared helpers for the hand-computed scheduling scenarios.
 */
final class SchedulingFixtures {

    private SchedulingFixtures() {
    }

    static TaskRegistry registry(Task... tasks) throws Exception {
        TaskRegistry registry = new TaskRegistry();
        for (Task task : tasks) {
            registry.add(task);
        }
        return registry;
    }

    /**
     * P1(0,5) P2(1,3) P3(2,1)
     */
    static TaskRegistry threeTasks() throws Exception {
        return registry(new Task("P1", 0, 5, 0), new Task("P2", 1, 3, 0), new Task("P3", 2, 1, 0));
    }

    static SimulationResult run(TaskRegistry registry, SimulatorConfig.PolicyType policy) throws Exception {
        return Simulator.simulate(registry, new SimulatorConfig(policy));
    }

    static SimulationResult run(TaskRegistry registry, SimulatorConfig config) throws Exception {
        return Simulator.simulate(registry, config);
    }

    /**
     * Timeline as "P1:0-5" strings.
     */
    static List<String> timeline(SimulationResult result) {
        List<String> out = new ArrayList<>();
        for (GanttSegment segment : result.getSegments()) {
            out.add(segment.toString());
        }
        return out;
    }
}

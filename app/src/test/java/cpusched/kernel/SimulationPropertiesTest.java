package cpusched.kernel;

import cpusched.io.WorkloadGenerator;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Timeline invariants that every policy must keep, checked over a batch of
 * seeded random workloads plus one with dependency chains.
 */
public class SimulationPropertiesTest {

    private static final long[] SEEDS = { 1, 7, 42, 99, 2024, 31337 };

    private static List<TaskRegistry> workloads() throws Exception {
        List<TaskRegistry> workloads = new ArrayList<>();
        for (long seed : SEEDS) {
            workloads.add(new WorkloadGenerator(seed).generate());
        }
        TaskRegistry chained = new TaskRegistry();
        chained.add(new Task("A", 0, 4, 2));
        chained.add(new Task("B", 0, 2, 0, List.of("A")));
        chained.add(new Task("C", 1, 3, 1, List.of("A")));
        chained.add(new Task("D", 2, 1, 0, List.of("B", "C")));
        chained.add(new Task("E", 9, 2, 3));
        workloads.add(chained);
        return workloads;
    }

    private static SimulatorConfig config(SimulatorConfig.PolicyType policy) {
        SimulatorConfig config = new SimulatorConfig(policy);
        config.setQuantum(3);
        return config;
    }

    @Test
    void testSegmentsPartitionTimeline() throws Exception {
        for (SimulatorConfig.PolicyType policy : SimulatorConfig.PolicyType.values()) {
            for (TaskRegistry registry : workloads()) {
                List<GanttSegment> segments = Simulator.simulate(registry, config(policy)).getSegments();
                int cursor = 0;
                for (GanttSegment segment : segments) {
                    assertEquals(cursor, segment.getStart(), policy + ": gap or overlap at " + segment);
                    assertTrue(segment.getEnd() > segment.getStart());
                    cursor = segment.getEnd();
                }
            }
        }
    }

    @Test
    void testEachTaskRunsExactlyItsBurst() throws Exception {
        for (SimulatorConfig.PolicyType policy : SimulatorConfig.PolicyType.values()) {
            for (TaskRegistry registry : workloads()) {
                SimulationResult result = Simulator.simulate(registry, config(policy));
                Map<String, Integer> executed = new HashMap<>();
                Map<String, Integer> lastEnd = new HashMap<>();
                for (GanttSegment segment : result.getSegments()) {
                    if (!segment.isIdle()) {
                        executed.merge(segment.getTaskId(), segment.getDuration(), Integer::sum);
                        lastEnd.put(segment.getTaskId(), segment.getEnd());
                    }
                }
                for (Task task : registry.getTasks()) {
                    assertEquals(task.getBurstTime(), executed.get(task.getId()), policy + " " + task.getId());
                    assertEquals(lastEnd.get(task.getId()), registry.getRunState(task.getId()).getFinishTime());
                    assertTrue(result.getMetrics().getTask(task.getId()).startTime >= task.getArrivalTime());
                }
            }
        }
    }

    @Test
    void testNonPreemptivePoliciesRunEachTaskOnce() throws Exception {
        SimulatorConfig.PolicyType[] policies = {
                SimulatorConfig.PolicyType.FCFS, SimulatorConfig.PolicyType.SJF, SimulatorConfig.PolicyType.PRIORITY };
        for (SimulatorConfig.PolicyType policy : policies) {
            for (TaskRegistry registry : workloads()) {
                int runSegments = 0;
                for (GanttSegment segment : Simulator.simulate(registry, config(policy)).getSegments()) {
                    if (!segment.isIdle()) {
                        runSegments++;
                    }
                }
                assertEquals(registry.size(), runSegments, policy.name());
            }
        }
    }

    @Test
    void testRoundRobinSlicesNeverExceedQuantum() throws Exception {
        for (TaskRegistry registry : workloads()) {
            for (GanttSegment segment : Simulator.simulate(registry, config(SimulatorConfig.PolicyType.ROUND_ROBIN))
                    .getSegments()) {
                if (!segment.isIdle()) {
                    assertTrue(segment.getDuration() <= 3, "slice too long: " + segment);
                }
            }
        }
    }

    @Test
    void testDependenciesFinishBeforeDependentsStart() throws Exception {
        for (SimulatorConfig.PolicyType policy : SimulatorConfig.PolicyType.values()) {
            List<TaskRegistry> all = workloads();
            TaskRegistry chained = all.get(all.size() - 1);
            SimulationResult result = Simulator.simulate(chained, config(policy));
            for (Task task : chained.getTasks()) {
                int start = result.getMetrics().getTask(task.getId()).startTime;
                for (String dep : task.getDependencies()) {
                    assertTrue(result.getMetrics().getTask(dep).finishTime <= start,
                            policy + ": " + task.getId() + " started before " + dep + " finished");
                }
            }
        }
    }

    @Test
    void testRepeatedRunsAreIdentical() throws Exception {
        for (SimulatorConfig.PolicyType policy : SimulatorConfig.PolicyType.values()) {
            TaskRegistry registry = new WorkloadGenerator(5).generate();
            SimulationLog first = new SimulationLog();
            SimulationLog second = new SimulationLog();
            SimulationResult a = Simulator.simulate(registry, config(policy), first);
            SimulationResult b = Simulator.simulate(registry, config(policy), second);
            assertEquals(a.getSegments(), b.getSegments(), policy.name());
            assertEquals(a.getMetrics().getAverageWaitingTime(), b.getMetrics().getAverageWaitingTime());
            assertEquals(first.getEntries(), second.getEntries());
        }
    }

    @Test
    void testUtilizationNeverExceedsOne() throws Exception {
        for (SimulatorConfig.PolicyType policy : SimulatorConfig.PolicyType.values()) {
            for (TaskRegistry registry : workloads()) {
                double utilization = Simulator.simulate(registry, config(policy)).getMetrics().getCpuUtilization();
                assertTrue(utilization > 0 && utilization <= 1.0, policy + ": " + utilization);
            }
        }
    }
}

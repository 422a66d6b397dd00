package cpusched.kernel.scheduler;

import cpusched.kernel.SimulationResult;
import cpusched.kernel.SimulatorConfig.PolicyType;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static cpusched.kernel.scheduler.SchedulingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class FcfsSchedulerTest {

    @Test
    void testReferenceScenario() throws Exception {
        SimulationResult result = run(threeTasks(), PolicyType.FCFS);

        assertEquals(List.of("P1:0-5", "P2:5-8", "P3:8-9"), timeline(result));
        assertEquals(0, result.getMetrics().getTask("P1").getWaitingTime());
        assertEquals(4, result.getMetrics().getTask("P2").getWaitingTime());
        assertEquals(6, result.getMetrics().getTask("P3").getWaitingTime());
        assertEquals(10.0 / 3, result.getMetrics().getAverageWaitingTime(), 1e-9);
        assertEquals("3.33", String.format(Locale.ROOT, "%.2f",
                result.getMetrics().getAverageWaitingTime()));
    }

    @Test
    void testSameArrivalBreaksTieById() throws Exception {
        TaskRegistry registry = registry(new Task("B", 0, 2, 0), new Task("A", 0, 3, 0), new Task("C", 0, 1, 0));
        assertEquals(List.of("A:0-3", "B:3-5", "C:5-6"), timeline(run(registry, PolicyType.FCFS)));
    }

    @Test
    void testNumberedIdsBreakTiesNumerically() throws Exception {
        TaskRegistry registry = registry(new Task("P10", 0, 1, 0), new Task("P2", 0, 1, 0));
        assertEquals(List.of("P2:0-1", "P10:1-2"), timeline(run(registry, PolicyType.FCFS)));
    }

    @Test
    void testIdleGapBeforeLateArrival() throws Exception {
        TaskRegistry registry = registry(new Task("P1", 2, 2, 0), new Task("P2", 10, 1, 0));
        SimulationResult result = run(registry, PolicyType.FCFS);

        assertEquals(List.of("Idle:0-2", "P1:2-4", "Idle:4-10", "P2:10-11"), timeline(result));
        assertTrue(result.getSegments().get(0).isIdle());
    }

    @Test
    void testDependencyDelaysDispatch() throws Exception {
        TaskRegistry registry = registry(new Task("P1", 0, 3, 0), new Task("P2", 0, 2, 0, List.of("P1")),
                new Task("P3", 1, 1, 0));
        assertEquals(List.of("P1:0-3", "P2:3-5", "P3:5-6"), timeline(run(registry, PolicyType.FCFS)));
    }

    @Test
    void testStatsCountSwitches() throws Exception {
        SimulationResult result = run(threeTasks(), PolicyType.FCFS);
        assertEquals("FCFS", result.getStats().algorithmName);
        assertEquals(3, result.getStats().totalDecisions);
        assertEquals(2, result.getStats().contextSwitches);
        assertEquals(0, result.getStats().preemptions);
    }
}

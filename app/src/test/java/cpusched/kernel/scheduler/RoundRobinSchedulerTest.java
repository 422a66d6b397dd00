package cpusched.kernel.scheduler;

import cpusched.Exception.ConfigurationException;
import cpusched.kernel.GanttSegment;
import cpusched.kernel.SimulationResult;
import cpusched.kernel.SimulatorConfig;
import cpusched.kernel.SimulatorConfig.PolicyType;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static cpusched.kernel.scheduler.SchedulingFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class RoundRobinSchedulerTest {

    private static SimulatorConfig roundRobin(int quantum) {
        SimulatorConfig config = new SimulatorConfig(PolicyType.ROUND_ROBIN);
        config.setQuantum(quantum);
        return config;
    }

    @Test
    void testQuantumTwoReferenceTable() throws Exception {
        TaskRegistry registry = registry(new Task("P1", 0, 5, 0), new Task("P2", 1, 3, 0));
        SimulationResult result = run(registry, roundRobin(2));

        assertEquals(List.of("P1:0-2", "P2:2-4", "P1:4-6", "P2:6-7", "P1:7-8"), timeline(result));
        assertEquals("Round Robin (q=2)", result.getAlgorithmName());
    }

    @Test
    void testArrivalAtExpiryQueuesBeforeExpiredTask() throws Exception {
        TaskRegistry registry = registry(new Task("P1", 0, 4, 0), new Task("P2", 2, 2, 0));
        assertEquals(List.of("P1:0-2", "P2:2-4", "P1:4-6"), timeline(run(registry, roundRobin(2))));
    }

    @Test
    void testArrivalsDuringSliceKeepArrivalOrder() throws Exception {
        TaskRegistry registry = registry(new Task("P1", 0, 6, 0), new Task("P3", 1, 2, 0),
                new Task("P2", 2, 2, 0));
        // P3 arrived before P2 during P1's first slice
        assertEquals(List.of("P1:0-3", "P3:3-5", "P2:5-7", "P1:7-10"), timeline(run(registry, roundRobin(3))));
    }

    @Test
    void testLoneTaskGetsSeparateSlices() throws Exception {
        SimulationResult result = run(registry(new Task("P1", 0, 5, 0)), roundRobin(2));

        assertEquals(List.of("P1:0-2", "P1:2-4", "P1:4-5"), timeline(result));
        for (GanttSegment segment : result.getSegments()) {
            assertTrue(segment.getDuration() <= 2);
        }
    }

    @Test
    void testNonPositiveQuantumRejected() {
        assertThrows(ConfigurationException.class, () -> run(threeTasks(), roundRobin(0)));
        assertThrows(ConfigurationException.class, () -> run(threeTasks(), roundRobin(-3)));
        assertThrows(IllegalArgumentException.class, () -> new RoundRobinScheduler(0));
    }
}

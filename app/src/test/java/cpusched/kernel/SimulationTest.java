package cpusched.kernel;

import cpusched.Enum.SimulationState;
import cpusched.Exception.ConfigurationException;
import cpusched.Exception.DeadlockException;
import cpusched.Exception.EmptyInputException;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the step-driven simulation loop
 */
public class SimulationTest {

    private TaskRegistry registry;
    private SimulatorConfig config;

    @BeforeEach
    void setUp() throws Exception {
        registry = new TaskRegistry();
        registry.add(new Task("P1", 2, 3, 0));
        registry.add(new Task("P2", 3, 2, 0));
        config = new SimulatorConfig(SimulatorConfig.PolicyType.FCFS);
    }

    @Test
    void testStateMachine() throws Exception {
        Simulation simulation = new Simulation(registry, config, null);
        assertEquals(SimulationState.NOT_STARTED, simulation.getState());

        assertTrue(simulation.step());
        assertEquals(SimulationState.IDLE, simulation.getState());
        assertEquals(2, simulation.getTime());

        assertTrue(simulation.step());
        assertEquals(SimulationState.RUNNING, simulation.getState());
        assertEquals(5, simulation.getTime());

        assertFalse(simulation.step());
        assertEquals(SimulationState.FINISHED, simulation.getState());
        assertTrue(simulation.isFinished());
        assertFalse(simulation.step());

        assertEquals(List.of(GanttSegment.idle(0, 2), GanttSegment.run("P1", 2, 5), GanttSegment.run("P2", 5, 7)),
                simulation.getSegments());
    }

    @Test
    void testCancelKeepsConsistentPrefix() throws Exception {
        Simulation simulation = new Simulation(registry, config, null);
        simulation.step();
        simulation.step();
        simulation.cancel();

        assertTrue(simulation.isCancelled());
        assertFalse(simulation.step());
        List<GanttSegment> partial = simulation.getSegments();
        assertEquals(2, partial.size());
        assertEquals(0, partial.get(0).getStart());
        assertEquals(partial.get(0).getEnd(), partial.get(1).getStart());
        assertEquals(simulation.getTime(), partial.get(1).getEnd());
        assertNotEquals(SimulationState.FINISHED, simulation.getState());
        List<String> entries = simulation.getLog().getEntries();
        assertEquals("[t=   5] Simulation cancelled", entries.get(entries.size() - 1));
    }

    @Test
    void testSteppingOverCopyIgnoresEditsToOriginal() throws Exception {
        TaskRegistry original = new TaskRegistry();
        original.add(new Task("P1", 0, 5, 0));
        original.add(new Task("P2", 0, 5, 0));
        original.add(new Task("P3", 0, 5, 0));
        TaskRegistry working = original.copy();
        Simulation simulation = new Simulation(working,
                new SimulatorConfig(SimulatorConfig.PolicyType.ROUND_ROBIN), null);

        assertTrue(simulation.step());
        original.remove("P2");
        original.clear();
        simulation.run();

        assertTrue(simulation.isFinished());
        assertTrue(working.allFinished());
        assertEquals(15, simulation.getTime());
        assertTrue(simulation.getSegments().contains(GanttSegment.run("P2", 2, 4)));
        assertFalse(original.contains("P2"));
    }

    @Test
    void testCyclicDependenciesRejectedBeforeStart() throws Exception {
        TaskRegistry cyclic = new TaskRegistry();
        cyclic.add(new Task("P1", 0, 2, 0, List.of("P2")));
        cyclic.add(new Task("P2", 0, 2, 0, List.of("P1")));

        assertThrows(ConfigurationException.class, () -> Simulator.simulate(cyclic, config));
        assertNull(cyclic.getRunState("P1").getStartTime());
    }

    @Test
    void testUnsatisfiableReadinessIsDeadlock() throws Exception {
        TaskRegistry cyclic = new TaskRegistry();
        cyclic.add(new Task("P1", 0, 2, 0, List.of("P2")));
        cyclic.add(new Task("P2", 3, 2, 0, List.of("P1")));
        cyclic.add(new Task("P3", 0, 1, 0));

        Simulation simulation = new Simulation(cyclic, config, null, false);
        DeadlockException e = assertThrows(DeadlockException.class, simulation::run);
        assertEquals("P1", e.getTaskId());
        assertEquals(3, e.getTime());
        // emitted segments still partition [0, 3]
        assertEquals(List.of(GanttSegment.run("P3", 0, 1), GanttSegment.idle(1, 3)), simulation.getSegments());
    }

    @Test
    void testEmptyRegistry() {
        assertThrows(EmptyInputException.class, () -> Simulator.simulate(new TaskRegistry(), config));
    }

    @Test
    void testInvalidConfigurationRejected() {
        config.setStarvationThreshold(0);
        assertThrows(ConfigurationException.class, () -> new Simulation(registry, config, null));
    }

    @Test
    void testRunResetsPreviousRunState() throws Exception {
        Simulator.simulate(registry, config);
        assertTrue(registry.allFinished());

        Simulation simulation = new Simulation(registry, config, null);
        assertFalse(registry.allFinished());
        assertEquals(3, registry.getRunState("P1").getRemainingTime());
        simulation.run();
        assertTrue(registry.allFinished());
    }

    @Test
    void testLogRecordsEventsInSimulatedTime() throws Exception {
        SimulationLog log = new SimulationLog();
        StringBuilder seen = new StringBuilder();
        log.addListener(entry -> seen.append(entry).append('\n'));

        Simulator.simulate(registry, config, log);

        List<String> entries = log.getEntries();
        assertEquals("[t=   0] CPU idle until 2", entries.get(0));
        assertTrue(entries.contains("[t=   5] Task P1 finished"));
        assertEquals("[t=   7] All tasks finished", entries.get(entries.size() - 1));
        assertEquals(String.join("\n", entries) + "\n", seen.toString());
    }

    @Test
    void testPreemptionIsLogged() throws Exception {
        TaskRegistry tasks = new TaskRegistry();
        tasks.add(new Task("P1", 0, 5, 0));
        tasks.add(new Task("P2", 1, 1, 0));
        SimulationLog log = new SimulationLog();

        Simulator.simulate(tasks, new SimulatorConfig(SimulatorConfig.PolicyType.SRTF), log);
        assertTrue(log.getEntries().contains("[t=   1] Preempt P1 for P2"));
        assertTrue(log.getEntries().contains("[t=   2] Resume run P1 for 4"));
    }
}

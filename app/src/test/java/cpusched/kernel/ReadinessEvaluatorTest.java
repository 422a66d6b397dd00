package cpusched.kernel;

import cpusched.Exception.ConfigurationException;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReadinessEvaluatorTest {

    private TaskRegistry registry;
    private ReadinessEvaluator readiness;

    @BeforeEach
    void setUp() throws Exception {
        registry = new TaskRegistry();
        registry.add(new Task("P3", 0, 2, 0));
        registry.add(new Task("P1", 0, 3, 0));
        registry.add(new Task("P2", 1, 2, 0, List.of("P1")));
        registry.add(new Task("P4", 6, 1, 0));
        readiness = new ReadinessEvaluator(registry);
    }

    private List<String> ids(List<Task> tasks) {
        List<String> ids = new ArrayList<>();
        for (Task task : tasks) {
            ids.add(task.getId());
        }
        return ids;
    }

    @Test
    void testReadySetIsSortedById() {
        assertEquals(List.of("P1", "P3"), ids(readiness.readySet(0)));
    }

    @Test
    void testDependencyBlocksUntilFinished() {
        assertFalse(readiness.isReady(registry.get("P2"), 2));
        assertTrue(readiness.readyAt(registry.get("P2")).isEmpty());

        registry.getRunState("P1").execute(0, 3);
        // finished at 3, not yet at 2
        assertFalse(readiness.isReady(registry.get("P2"), 2));
        assertTrue(readiness.isReady(registry.get("P2"), 3));
        assertEquals(3, readiness.readyAt(registry.get("P2")).getAsInt());
        assertEquals(List.of("P2", "P3"), ids(readiness.readySet(3)));
    }

    @Test
    void testFinishedTasksAreNotReady() {
        registry.getRunState("P3").execute(0, 2);
        assertEquals(List.of("P1"), ids(readiness.readySet(2)));
    }

    @Test
    void testNextArrival() {
        assertEquals(1, readiness.nextArrivalAfter(0).getAsInt());
        assertEquals(6, readiness.nextArrivalAfter(1).getAsInt());
        assertTrue(readiness.nextArrivalAfter(6).isEmpty());
    }

    @Test
    void testValidateAcceptsAcyclicGraph() throws Exception {
        readiness.validate();
    }

    @Test
    void testUnknownDependencyIsConfigurationError() throws Exception {
        registry.add(new Task("P5", 0, 1, 0, List.of("P9")));
        ConfigurationException e = assertThrows(ConfigurationException.class, readiness::validate);
        assertEquals("P5", e.getTaskId());
        assertTrue(e.getMessage().contains("P9"));
    }

    @Test
    void testCycleIsConfigurationError() throws Exception {
        TaskRegistry cyclic = new TaskRegistry();
        cyclic.add(new Task("P1", 0, 1, 0, List.of("P2")));
        cyclic.add(new Task("P2", 0, 1, 0, List.of("P1")));
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new ReadinessEvaluator(cyclic).validate());
        assertTrue(e.getMessage().contains("cycle"));
    }

    @Test
    void testLongCycleAndSelfDependency() throws Exception {
        TaskRegistry cyclic = new TaskRegistry();
        cyclic.add(new Task("A", 0, 1, 0, List.of("C")));
        cyclic.add(new Task("B", 0, 1, 0, List.of("A")));
        cyclic.add(new Task("C", 0, 1, 0, List.of("B")));
        assertThrows(ConfigurationException.class, () -> new ReadinessEvaluator(cyclic).validate());

        TaskRegistry self = new TaskRegistry();
        self.add(new Task("S", 0, 1, 0, List.of("S")));
        assertThrows(ConfigurationException.class, () -> new ReadinessEvaluator(self).validate());
    }
}

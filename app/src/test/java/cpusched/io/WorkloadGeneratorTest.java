package cpusched.io;

import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WorkloadGeneratorTest {

    @Test
    void testSameSeedSameWorkload() throws Exception {
        TaskRegistry a = new WorkloadGenerator(42).generate();
        TaskRegistry b = new WorkloadGenerator(42).generate();
        assertEquals(a.getTasks(), b.getTasks());
    }

    @Test
    void testValueRanges() throws Exception {
        for (long seed = 0; seed < 50; seed++) {
            TaskRegistry registry = new WorkloadGenerator(seed).generate();
            assertTrue(registry.size() >= 3 && registry.size() <= 10, "size " + registry.size());
            int n = 1;
            for (Task task : registry.getTasks()) {
                assertEquals("P" + n++, task.getId());
                assertTrue(task.getArrivalTime() >= 0 && task.getArrivalTime() <= 10);
                assertTrue(task.getBurstTime() >= 1 && task.getBurstTime() <= 10);
                assertTrue(task.getPriority() >= 0 && task.getPriority() <= 5);
                assertTrue(task.getDependencies().isEmpty());
            }
        }
    }

    @Test
    void testAppendContinuesNumbering() throws Exception {
        TaskRegistry registry = new TaskRegistry();
        registry.add(new Task("P2", 0, 1, 0));

        int added = new WorkloadGenerator(7).appendTo(registry);
        assertEquals(added + 1, registry.size());
        assertTrue(registry.contains("P3"));
        assertFalse(registry.contains("P1"));
    }
}

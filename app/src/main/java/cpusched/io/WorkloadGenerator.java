package cpusched.io;

import cpusched.Exception.DuplicateIdException;
import cpusched.Exception.InvalidInputException;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;

import java.util.Random;

/**
 * Random workloads for quick experiments: 3 to 10 tasks, arrival 0-10,
 * burst 1-10, priority 0-5, no dependencies. The same seed always yields
 * the same workload.
 */
public class WorkloadGenerator {
    private static final int MIN_TASKS = 3;
    private static final int MAX_TASKS = 10;
    private static final int MAX_ARRIVAL = 10;
    private static final int MAX_BURST = 10;
    private static final int MAX_PRIORITY = 5;

    private final Random random;

    public WorkloadGenerator(long seed) {
        this.random = new Random(seed);
    }

    public TaskRegistry generate() throws InvalidInputException, DuplicateIdException {
        TaskRegistry registry = new TaskRegistry();
        appendTo(registry);
        return registry;
    }

    /**
     * Add a random batch to an existing registry, continuing its P1, P2, ... numbering.
     *
     * @return number of tasks added
     */
    public int appendTo(TaskRegistry registry) throws InvalidInputException, DuplicateIdException {
        int count = MIN_TASKS + random.nextInt(MAX_TASKS - MIN_TASKS + 1);
        int number = registry.size() + 1;
        for (int i = 0; i < count; i++) {
            while (registry.contains("P" + number)) {
                number++;
            }
            registry.add(new Task("P" + number,
                    random.nextInt(MAX_ARRIVAL + 1),
                    1 + random.nextInt(MAX_BURST),
                    random.nextInt(MAX_PRIORITY + 1)));
            number++;
        }
        return count;
    }
}

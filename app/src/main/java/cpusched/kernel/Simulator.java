package cpusched.kernel;

import cpusched.Exception.EmptyInputException;
import cpusched.Exception.SchedulingException;
import cpusched.kernel.process.TaskRegistry;
import cpusched.kernel.scheduler.FcfsScheduler;
import cpusched.kernel.scheduler.IntelligentScheduler;
import cpusched.kernel.scheduler.MultilevelFeedbackScheduler;
import cpusched.kernel.scheduler.PreemptivePriorityScheduler;
import cpusched.kernel.scheduler.PriorityScheduler;
import cpusched.kernel.scheduler.RoundRobinScheduler;
import cpusched.kernel.scheduler.Scheduler;
import cpusched.kernel.scheduler.ShortestJobFirstScheduler;
import cpusched.kernel.scheduler.ShortestRemainingTimeScheduler;
import cpusched.metrics.MetricsCalculator;
import cpusched.metrics.MetricsRecord;

/**
 * Entry point of the engine: runs one policy over a registry synchronously
 * and returns the timeline with its metrics.
 */
public final class Simulator {

    private Simulator() {
    }

    public static SimulationResult simulate(TaskRegistry registry, SimulatorConfig config)
            throws SchedulingException {
        return simulate(registry, config, null);
    }

    public static SimulationResult simulate(TaskRegistry registry, SimulatorConfig.PolicyType policy)
            throws SchedulingException {
        return simulate(registry, new SimulatorConfig(policy), null);
    }

    /**
     * Reset the registry's run-state, validate configuration and dependencies,
     * run to completion and compute metrics.
     *
     * @param log receives the run's events; may be null
     */
    public static SimulationResult simulate(TaskRegistry registry, SimulatorConfig config, SimulationLog log)
            throws SchedulingException {
        if (registry.isEmpty()) {
            throw new EmptyInputException("No tasks to schedule");
        }
        Simulation simulation = new Simulation(registry, config, log);
        simulation.run();

        MetricsRecord metrics = MetricsCalculator.calculate(registry, simulation.getSegments());
        Scheduler scheduler = simulation.getScheduler();
        return new SimulationResult(scheduler.getName(), simulation.getSegments(), metrics, scheduler.getStats());
    }

    /**
     * Factory method to create a scheduler based on configuration.
     * Each run gets a fresh instance so statistics never leak between runs.
     */
    public static Scheduler createScheduler(SimulatorConfig config) {
        switch (config.getPolicyType()) {
            case FCFS:
                return new FcfsScheduler();
            case SJF:
                return new ShortestJobFirstScheduler();
            case SRTF:
                return new ShortestRemainingTimeScheduler();
            case ROUND_ROBIN:
                return new RoundRobinScheduler(config.getQuantum());
            case PRIORITY:
                return new PriorityScheduler(config.getPriorityOrder());
            case PRIORITY_PREEMPTIVE:
                return new PreemptivePriorityScheduler(config.getPriorityOrder());
            case MLFQ:
                return new MultilevelFeedbackScheduler(config.getQuantum(), config.getFeedbackLevels());
            case INTELLIGENT:
                return new IntelligentScheduler(config.getWaitWeight(), config.getBurstWeight(),
                        config.getPriorityWeight(), config.getStarvationThreshold(), config.getPriorityOrder());
            default:
                throw new IllegalArgumentException("Unsupported policy " + config.getPolicyType());
        }
    }
}

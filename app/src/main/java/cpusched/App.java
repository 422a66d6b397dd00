package cpusched;

import cpusched.Exception.SchedulingException;
import cpusched.io.CsvExporter;
import cpusched.io.WorkloadGenerator;
import cpusched.io.WorkloadStore;
import cpusched.kernel.GanttSegment;
import cpusched.kernel.SimulationLog;
import cpusched.kernel.SimulationResult;
import cpusched.kernel.Simulator;
import cpusched.kernel.SimulatorConfig;
import cpusched.kernel.process.Task;
import cpusched.kernel.process.TaskRegistry;
import cpusched.metrics.TaskMetrics;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Command line front end.
 *
 * <pre>
 * app &lt;workload.json&gt; [--policy NAME] [--quantum N] [--config file.properties] [--csv out.csv] [--quiet]
 * app --random SEED [...]
 * </pre>
 */
public class App {

    private static final String USAGE = "Usage: app <workload.json> | --random SEED"
            + " [--policy NAME] [--quantum N] [--config file.properties] [--csv out.csv] [--quiet]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * @return process exit status
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        Path workload = null;
        Long seed = null;
        String policy = null;
        Integer quantum = null;
        Path configFile = null;
        Path csvFile = null;
        boolean quiet = false;

        try {
            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case "--policy":
                        policy = value(args, ++i);
                        break;
                    case "--quantum":
                        quantum = Integer.parseInt(value(args, ++i));
                        break;
                    case "--config":
                        configFile = Path.of(value(args, ++i));
                        break;
                    case "--csv":
                        csvFile = Path.of(value(args, ++i));
                        break;
                    case "--random":
                        seed = Long.parseLong(value(args, ++i));
                        break;
                    case "--quiet":
                        quiet = true;
                        break;
                    default:
                        if (args[i].startsWith("--") || workload != null) {
                            throw new IllegalArgumentException("Unexpected argument: " + args[i]);
                        }
                        workload = Path.of(args[i]);
                }
            }
            if ((workload == null) == (seed == null)) {
                throw new IllegalArgumentException("Give either a workload file or --random SEED");
            }
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return 2;
        }

        try {
            SimulatorConfig config = loadConfig(configFile);
            if (policy != null) {
                config.setPolicyType(SimulatorConfig.PolicyType.parse(policy));
            }
            if (quantum != null) {
                config.setQuantum(quantum);
            }

            TaskRegistry registry = workload != null
                    ? new WorkloadStore().load(workload)
                    : new WorkloadGenerator(seed).generate();
            out.println("Simulator: Loaded " + registry.size() + " tasks");
            for (Task task : registry.getTasks()) {
                out.println("  " + task);
            }

            SimulationLog log = new SimulationLog();
            if (!quiet) {
                log.addListener(out::println);
            }
            SimulationResult result = Simulator.simulate(registry, config, log);
            printResult(result, out);

            if (csvFile != null) {
                CsvExporter.export(result.getMetrics(), result.getAlgorithmName(), csvFile);
                out.println("Simulator: Metrics exported to " + csvFile.toAbsolutePath());
            }
            return 0;
        } catch (SchedulingException e) {
            err.println("Simulator: " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Simulator: I/O error: " + e.getMessage());
            return 1;
        }
    }

    private static SimulatorConfig loadConfig(Path configFile) throws IOException, SchedulingException {
        if (configFile == null) {
            return SimulatorConfig.loadDefault();
        }
        try (InputStream in = Files.newInputStream(configFile)) {
            return SimulatorConfig.load(in);
        }
    }

    static void printResult(SimulationResult result, PrintStream out) {
        out.println();
        out.println("Algorithm: " + result.getAlgorithmName());
        StringBuilder gantt = new StringBuilder("Gantt: ");
        for (GanttSegment segment : result.getSegments()) {
            gantt.append('[').append(segment).append("] ");
        }
        out.println(gantt.toString().trim());
        out.println();
        out.println(String.format("%-8s %6s %6s %6s %8s %10s", "PID", "Start", "End", "Wait", "Turn", "Response"));
        for (TaskMetrics row : result.getMetrics().getTasks()) {
            out.println(String.format("%-8s %6d %6d %6d %8d %10d", row.taskId, row.startTime, row.finishTime,
                    row.getWaitingTime(), row.getTurnaroundTime(), row.getResponseTime()));
        }
        out.println();
        out.println(result.getMetrics());
        out.println(result.getStats());
    }

    private static String value(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + args[index - 1]);
        }
        return args[index];
    }
}

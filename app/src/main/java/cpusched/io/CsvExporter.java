package cpusched.io;

import cpusched.metrics.MetricsRecord;
import cpusched.metrics.TaskMetrics;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes a metrics record as CSV: a header and one row per task, a blank
 * line, then the aggregate figures as key/value rows.
 */
public final class CsvExporter {
    public static final String HEADER = "PID,Arrival,Burst,Priority,Start,Finish,Waiting,Turnaround,Response";

    private CsvExporter() {
    }

    public static void export(MetricsRecord metrics, String algorithmName, Path file) throws IOException {
        try (Writer out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(metrics, algorithmName, out);
        }
    }

    public static void write(MetricsRecord metrics, String algorithmName, Writer out) throws IOException {
        out.write(HEADER);
        out.write('\n');
        for (TaskMetrics row : metrics.getTasks()) {
            out.write(String.join(",",
                    quote(row.taskId),
                    Integer.toString(row.arrivalTime),
                    Integer.toString(row.burstTime),
                    Integer.toString(row.priority),
                    Integer.toString(row.startTime),
                    Integer.toString(row.finishTime),
                    Integer.toString(row.getWaitingTime()),
                    Integer.toString(row.getTurnaroundTime()),
                    Integer.toString(row.getResponseTime())));
            out.write('\n');
        }
        out.write('\n');
        out.write("Algorithm," + quote(algorithmName) + "\n");
        out.write("Average Waiting Time," + format(metrics.getAverageWaitingTime()) + "\n");
        out.write("Average Turnaround Time," + format(metrics.getAverageTurnaroundTime()) + "\n");
        out.write("Average Response Time," + format(metrics.getAverageResponseTime()) + "\n");
        out.write("CPU Utilization," + format(metrics.getCpuUtilization()) + "\n");
        out.write("Throughput," + String.format(Locale.ROOT, "%.4f", metrics.getThroughput()) + "\n");
        out.write("Makespan," + metrics.getMakespan() + "\n");
        out.flush();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    static String quote(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}

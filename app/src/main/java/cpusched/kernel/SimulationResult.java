package cpusched.kernel;

import cpusched.kernel.scheduler.SchedulerStats;
import cpusched.metrics.MetricsRecord;

import java.util.Collections;
import java.util.List;

/**
 * Everything a finished run hands to the presentation layer.
 */
public class SimulationResult {
    private final String algorithmName;
    private final List<GanttSegment> segments;
    private final MetricsRecord metrics;
    private final SchedulerStats stats;

    public SimulationResult(String algorithmName, List<GanttSegment> segments, MetricsRecord metrics,
            SchedulerStats stats) {
        this.algorithmName = algorithmName;
        this.segments = Collections.unmodifiableList(segments);
        this.metrics = metrics;
        this.stats = stats;
    }

    public String getAlgorithmName() {
        return algorithmName;
    }

    public List<GanttSegment> getSegments() {
        return segments;
    }

    public MetricsRecord getMetrics() {
        return metrics;
    }

    public SchedulerStats getStats() {
        return stats;
    }
}

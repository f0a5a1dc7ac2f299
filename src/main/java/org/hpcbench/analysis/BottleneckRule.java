package org.hpcbench.analysis;

import java.util.List;
import org.hpcbench.metrics.Summary;

/**
 * One independent scoring heuristic. Rules never see each other's output.
 */
@FunctionalInterface
public interface BottleneckRule {
    List<Evidence> evaluate(Summary summary, ResourceTelemetry telemetry);
}

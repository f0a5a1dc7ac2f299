package org.hpcbench.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.hpcbench.metrics.LatencyDistribution;
import org.hpcbench.metrics.Summary;

/**
 * Built-in scoring heuristics.
 */
public final class BottleneckRules {
    private BottleneckRules() {}

    public static List<BottleneckRule> defaults() {
        return List.of(
            BottleneckRules::latencySpread,
            BottleneckRules::successRate,
            BottleneckRules::timeoutErrors,
            BottleneckRules::gpuUtilization,
            BottleneckRules::gpuMemory,
            BottleneckRules::cpuEfficiency,
            BottleneckRules::residentMemory,
            BottleneckRules::latencyShapeWithoutTelemetry,
            BottleneckRules::healthyOperation
        );
    }

    /**
     * p99/p50 above 5 points at queueing.
     */
    static List<Evidence> latencySpread(Summary summary, ResourceTelemetry telemetry) {
        double spread = summary.latency().tailSpread();
        if (spread > 5.0d) {
            return List.of(new Evidence(BottleneckCategory.QUEUEING, 3,
                "High latency spread: P99/P50 = " + format("%.1f", spread) + "x (queueing indicator)"));
        }
        return List.of();
    }

    static List<Evidence> successRate(Summary summary, ResourceTelemetry telemetry) {
        if (summary.successRate() < 95.0d) {
            return List.of(new Evidence(BottleneckCategory.QUEUEING, 2,
                "Low success rate: " + format("%.1f", summary.successRate()) + "% indicates overload"));
        }
        return List.of();
    }

    static List<Evidence> timeoutErrors(Summary summary, ResourceTelemetry telemetry) {
        if (summary.failedRequests() <= 0) {
            return List.of();
        }
        boolean timeouts = summary.errorSummary().keySet().stream()
            .anyMatch(error -> error.toLowerCase(Locale.ROOT).contains("timeout"));
        if (timeouts) {
            return List.of(new Evidence(BottleneckCategory.QUEUEING, 2,
                "Timeout errors detected (" + summary.failedRequests() + " failures)"));
        }
        return List.of();
    }

    static List<Evidence> gpuUtilization(Summary summary, ResourceTelemetry telemetry) {
        if (telemetry.gpu().isEmpty()) {
            return List.of();
        }
        double utilization = telemetry.gpu().get().utilizationPercent();
        String percent = format("%.0f", utilization);
        if (utilization > 90.0d) {
            return List.of(new Evidence(BottleneckCategory.GPU_BOUND, 3, "High GPU utilization: " + percent + "%"));
        }
        if (utilization > 70.0d) {
            return List.of(new Evidence(BottleneckCategory.GPU_BOUND, 1, "Moderate GPU utilization: " + percent + "%"));
        }
        if (utilization < 30.0d) {
            String reason = "Low GPU utilization: " + percent + "% (not GPU-bound)";
            return List.of(
                new Evidence(BottleneckCategory.CPU_BOUND, 1, reason),
                new Evidence(BottleneckCategory.NETWORK_IO, 1, reason)
            );
        }
        return List.of();
    }

    static List<Evidence> gpuMemory(Summary summary, ResourceTelemetry telemetry) {
        if (telemetry.gpu().isEmpty()) {
            return List.of();
        }
        double memoryPercent = telemetry.gpu().get().memoryPercent();
        if (memoryPercent > 90.0d) {
            return List.of(new Evidence(BottleneckCategory.MEMORY_BOUND, 2,
                "High GPU memory usage: " + format("%.0f", memoryPercent) + "%"));
        }
        return List.of();
    }

    static List<Evidence> cpuEfficiency(Summary summary, ResourceTelemetry telemetry) {
        if (telemetry.job().isEmpty()) {
            return List.of();
        }
        double efficiency = telemetry.job().get().cpuEfficiencyPercent();
        if (efficiency > 90.0d) {
            return List.of(new Evidence(BottleneckCategory.CPU_BOUND, 2,
                "High CPU efficiency: " + format("%.0f", efficiency) + "%"));
        }
        return List.of();
    }

    /**
     * Peak RSS above 8000 MB.
     */
    static List<Evidence> residentMemory(Summary summary, ResourceTelemetry telemetry) {
        if (telemetry.job().isEmpty()) {
            return List.of();
        }
        double maxRss = telemetry.job().get().maxRssMb();
        if (maxRss > 8000.0d) {
            return List.of(new Evidence(BottleneckCategory.MEMORY_BOUND, 2,
                "High memory usage: " + format("%.0f", maxRss) + " MB RSS"));
        }
        return List.of();
    }

    /**
     * Latency shape as a stand-in for hardware counters; only applies when no telemetry exists.
     */
    static List<Evidence> latencyShapeWithoutTelemetry(Summary summary, ResourceTelemetry telemetry) {
        if (!telemetry.isEmpty()) {
            return List.of();
        }
        LatencyDistribution latency = summary.latency();
        double spread = latency.tailSpread();
        List<Evidence> evidence = new ArrayList<>();
        if (latency.p99() > 2.0d) {
            evidence.add(new Evidence(BottleneckCategory.QUEUEING, 2,
                "High tail latency: P99 = " + format("%.2f", latency.p99()) + "s"));
        }
        if (spread > 3.0d) {
            evidence.add(new Evidence(BottleneckCategory.QUEUEING, 1, ""));
        } else if (spread < 1.5d && latency.avg() > 0.5d) {
            String reason = "Consistent latency (" + format("%.1f", spread) + "x spread) suggests compute-bound";
            evidence.add(new Evidence(BottleneckCategory.GPU_BOUND, 1, reason));
            evidence.add(new Evidence(BottleneckCategory.CPU_BOUND, 1, reason));
        }
        return evidence;
    }

    static List<Evidence> healthyOperation(Summary summary, ResourceTelemetry telemetry) {
        LatencyDistribution latency = summary.latency();
        if (summary.successRate() >= 99.0d && latency.tailSpread() < 2.0d && latency.p99() < 1.0d) {
            return List.of(new Evidence(BottleneckCategory.HEALTHY, 3, "System operating within normal parameters"));
        }
        return List.of();
    }

    private static String format(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }
}

package org.hpcbench.analysis;

import java.util.Map;
import java.util.Optional;

/**
 * Optional hardware measurements taken alongside a campaign.
 */
public final class ResourceTelemetry {
    private static final ResourceTelemetry NONE = new ResourceTelemetry(null, null);

    private final Gpu gpu;
    private final Job job;

    private ResourceTelemetry(Gpu gpu, Job job) {
        this.gpu = gpu;
        this.job = job;
    }

    public static ResourceTelemetry none() {
        return NONE;
    }

    public static ResourceTelemetry of(Gpu gpu, Job job) {
        return gpu == null && job == null ? NONE : new ResourceTelemetry(gpu, job);
    }

    /**
     * Reads the {@code gpu} and {@code slurm} sections of a metrics document. Missing or empty
     * sections count as absent.
     */
    public static ResourceTelemetry fromMap(Map<String, ?> metrics) {
        if (metrics == null) {
            return NONE;
        }
        Gpu gpu = null;
        if (metrics.get("gpu") instanceof Map<?, ?> section && !section.isEmpty()) {
            gpu = new Gpu(
                number(section, "gpu_utilization", 0.0d),
                number(section, "memory_used_mb", 0.0d),
                number(section, "memory_total_mb", 1.0d)
            );
        }
        Job job = null;
        if (metrics.get("slurm") instanceof Map<?, ?> section && !section.isEmpty()) {
            job = new Job(
                number(section, "max_rss_mb", 0.0d),
                number(section, "cpu_time_s", 0.0d),
                number(section, "elapsed_s", 1.0d)
            );
        }
        return of(gpu, job);
    }

    public Optional<Gpu> gpu() {
        return Optional.ofNullable(gpu);
    }

    public Optional<Job> job() {
        return Optional.ofNullable(job);
    }

    public boolean isEmpty() {
        return gpu == null && job == null;
    }

    private static double number(Map<?, ?> section, String key, double fallback) {
        Object value = section.get(key);
        return value instanceof Number number ? number.doubleValue() : fallback;
    }

    /**
     * GPU utilization in percent and memory in megabytes.
     */
    public record Gpu(double utilizationPercent, double memoryUsedMb, double memoryTotalMb) {
        public double memoryPercent() {
            return memoryTotalMb > 0.0d ? memoryUsedMb / memoryTotalMb * 100.0d : 0.0d;
        }
    }

    /**
     * Scheduler accounting for the service job.
     */
    public record Job(double maxRssMb, double cpuTimeSeconds, double elapsedSeconds) {
        public double cpuEfficiencyPercent() {
            return elapsedSeconds > 0.0d ? cpuTimeSeconds / elapsedSeconds * 100.0d : 0.0d;
        }
    }
}

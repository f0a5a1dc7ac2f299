package org.hpcbench.analysis;

import java.util.List;

/**
 * Bottleneck classes in tie-break order, each with its display label and tuning actions.
 */
public enum BottleneckCategory {
    GPU_BOUND("gpu_bound", "GPU Compute", List.of(
        "Consider using a smaller model or enabling quantization",
        "Increase batch size to improve GPU efficiency",
        "Enable tensor parallelism across multiple GPUs",
        "Check if model fits in GPU memory without swapping"
    )),
    CPU_BOUND("cpu_bound", "CPU Compute", List.of(
        "Profile CPU-intensive operations (tokenization, data loading)",
        "Consider using more CPU cores or faster processors",
        "Optimize data preprocessing pipeline",
        "Check for unnecessary CPU-GPU data transfers"
    )),
    MEMORY_BOUND("memory_bound", "Memory", List.of(
        "Reduce batch size to lower memory pressure",
        "Enable gradient checkpointing for training workloads",
        "Use memory-efficient attention mechanisms",
        "Consider model quantization (INT8/FP16)",
        "Check for memory leaks in long-running services"
    )),
    QUEUEING("queueing", "Service Queueing/Overload", List.of(
        "Reduce concurrency/request rate",
        "Scale horizontally with more service replicas",
        "Implement request queuing with backpressure",
        "Increase service timeout limits",
        "Add request rate limiting at the client"
    )),
    NETWORK_IO("network_io", "Network/I/O", List.of(
        "Check network bandwidth between client and service",
        "Reduce payload sizes where possible",
        "Enable compression for large responses",
        "Consider co-locating client and service on same node"
    )),
    HEALTHY("healthy", "No Significant Bottleneck", List.of(
        "System is operating well - consider testing higher load",
        "Document current configuration as baseline",
        "Monitor for degradation over time"
    )),
    UNKNOWN("unknown", "Unable to Determine", List.of(
        "Collect more detailed metrics (GPU utilization, CPU time)",
        "Run additional tests with varying concurrency",
        "Enable verbose logging to identify slow operations"
    ));

    static final int MAX_RECOMMENDATIONS = 5;

    private final String key;
    private final String label;
    private final List<String> recommendations;

    BottleneckCategory(String key, String label, List<String> recommendations) {
        this.key = key;
        this.label = label;
        this.recommendations = recommendations;
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    /**
     * Tuning actions, at most five.
     */
    public List<String> recommendations() {
        return recommendations.size() > MAX_RECOMMENDATIONS
            ? recommendations.subList(0, MAX_RECOMMENDATIONS)
            : recommendations;
    }

    /**
     * Categories that accumulate scores; {@link #UNKNOWN} is only ever a classification outcome.
     */
    public static List<BottleneckCategory> scored() {
        return List.of(GPU_BOUND, CPU_BOUND, MEMORY_BOUND, QUEUEING, NETWORK_IO, HEALTHY);
    }
}

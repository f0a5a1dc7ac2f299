package org.hpcbench.metrics;

import java.util.List;
import java.util.Map;

/**
 * Service-specific summary fields, selected by the {@code service_type} of the first record.
 */
@FunctionalInterface
public interface ServiceExtension {
    /**
     * @param successful successful records of the campaign
     * @param effectiveDurationSeconds wall-clock duration used for throughput, 0 when unknown
     * @param requestsPerSecond overall throughput
     * @return fields merged into the top level of the summary
     */
    Map<String, Object> extend(List<RequestRecord> successful, double effectiveDurationSeconds, double requestsPerSecond);
}

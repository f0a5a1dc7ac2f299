package org.hpcbench.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every structured log event.
 */
public final class CorrelationContext {
    private final String campaignId;
    private final String operation;
    private final String entityName;
    private final String jobId;

    private CorrelationContext(Builder builder) {
        this.campaignId = requireText(builder.campaignId, "campaignId");
        this.operation = requireText(builder.operation, "operation");
        this.entityName = normalize(builder.entityName);
        this.jobId = normalize(builder.jobId);
    }

    public static CorrelationContext of(String campaignId, String operation) {
        return builder(campaignId, operation).build();
    }

    public static Builder builder(String campaignId, String operation) {
        return new Builder(campaignId, operation);
    }

    public String campaignId() {
        return campaignId;
    }

    public String operation() {
        return operation;
    }

    public Optional<String> entityName() {
        return Optional.ofNullable(entityName);
    }

    public Optional<String> jobId() {
        return Optional.ofNullable(jobId);
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("campaignId", campaignId);
        fields.put("operation", operation);
        if (entityName != null) {
            fields.put("entity", entityName);
        }
        if (jobId != null) {
            fields.put("jobId", jobId);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String campaignId;
        private final String operation;
        private String entityName;
        private String jobId;

        private Builder(String campaignId, String operation) {
            this.campaignId = Objects.requireNonNull(campaignId, "campaignId");
            this.operation = Objects.requireNonNull(operation, "operation");
        }

        public Builder entity(String entityName) {
            this.entityName = entityName;
            return this;
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public CorrelationContext build() {
            return new CorrelationContext(this);
        }
    }
}

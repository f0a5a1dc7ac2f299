package org.hpcbench.store;

import java.util.Objects;

/**
 * Identifier for one persistence container: the entities of a single kind within a campaign.
 */
public final class ContainerKey {
    private final String campaignId;
    private final String kind;

    public ContainerKey(String campaignId, String kind) {
        this.campaignId = requirePathSegment("campaignId", campaignId);
        this.kind = requirePathSegment("kind", kind);
    }

    public static ContainerKey of(String campaignId, String kind) {
        return new ContainerKey(campaignId, kind);
    }

    public String campaignId() {
        return campaignId;
    }

    public String kind() {
        return kind;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ContainerKey)) {
            return false;
        }
        ContainerKey that = (ContainerKey) other;
        return campaignId.equals(that.campaignId) && kind.equals(that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(campaignId, kind);
    }

    @Override
    public String toString() {
        return campaignId + "/" + kind;
    }

    // Both parts become directory and file names in the file-backed store.
    private static String requirePathSegment(String fieldName, String value) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        String trimmed = value.trim();
        if (trimmed.contains("/") || trimmed.contains("\\") || trimmed.equals(".") || trimmed.equals("..")) {
            throw new IllegalArgumentException(fieldName + " must be a single path segment: " + value);
        }
        return trimmed;
    }
}

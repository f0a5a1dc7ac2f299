package org.hpcbench.deploy;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Point-in-time state of every deployment in a campaign.
 */
public record CampaignStatusSnapshot(String campaignId, Instant takenAt, List<EntityStatus> services, List<EntityStatus> clients) {
    public CampaignStatusSnapshot {
        Objects.requireNonNull(campaignId, "campaignId");
        Objects.requireNonNull(takenAt, "takenAt");
        services = List.copyOf(Objects.requireNonNull(services, "services"));
        clients = List.copyOf(Objects.requireNonNull(clients, "clients"));
    }

    public long clientsInTerminalState() {
        return clients.stream().filter(status -> status.state().isTerminal()).count();
    }
}

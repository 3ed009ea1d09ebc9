package com.tierflow.core.repository;

/**
 * A campaign with its attributed results.
 */
public record Campaign(
    String id,
    String clientId,
    Status status,
    long totalLeads,
    long qualifiedLeads,
    double revenueAttributed
) {

    public enum Status { DRAFT, ACTIVE, PAUSED, COMPLETED }

    public boolean active() {
        return status == Status.ACTIVE;
    }
}

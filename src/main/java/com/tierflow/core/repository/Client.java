package com.tierflow.core.repository;

import java.time.Instant;

/**
 * A client as far as business reporting needs it.
 *
 * @param monthlyBudget monthly budget; nullable when unknown
 */
public record Client(
    String id,
    String name,
    Double monthlyBudget,
    Instant createdAt
) {
}

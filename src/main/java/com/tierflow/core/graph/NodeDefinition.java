package com.tierflow.core.graph;

import com.tierflow.core.model.Tier;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A named node of the workflow graph bound to an agent capability.
 *
 * @param id               node id
 * @param capabilityTag    capability resolved through the registry; null for a routing-only node
 * @param tier             tier that owns the node
 * @param maxRetries       transient-failure retries allowed before the node is exhausted
 * @param timeout          maximum duration of a single agent call
 * @param requiredFields   payload fields that must be present to enter the graph here
 * @param escalationTarget node a task escalates to when this node is exhausted; nullable
 * @param resetsTier       when true, completing this node resets the task to OPERATIONAL
 */
public record NodeDefinition(
    String id,
    String capabilityTag,
    Tier tier,
    Integer maxRetries,
    Duration timeout,
    Set<String> requiredFields,
    String escalationTarget,
    boolean resetsTier
) {

    public NodeDefinition {
        Objects.requireNonNull(id, "id");
        tier = tier == null ? Tier.OPERATIONAL : tier;
        requiredFields = requiredFields == null ? Set.of() : Set.copyOf(requiredFields);
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0 for node " + id);
        }
    }

    public boolean routingOnly() {
        return capabilityTag == null;
    }

    NodeDefinition withDefaults(int defaultMaxRetries, Duration defaultTimeout) {
        return new NodeDefinition(id, capabilityTag, tier,
                maxRetries != null ? maxRetries : defaultMaxRetries,
                timeout != null ? timeout : defaultTimeout,
                requiredFields, escalationTarget, resetsTier);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String capabilityTag;
        private Tier tier = Tier.OPERATIONAL;
        private Integer maxRetries;
        private Duration timeout;
        private final Set<String> requiredFields = new LinkedHashSet<>();
        private String escalationTarget;
        private boolean resetsTier;

        private Builder(String id) {
            this.id = id;
        }

        public Builder capability(String capabilityTag) {
            this.capabilityTag = capabilityTag;
            return this;
        }

        public Builder tier(Tier tier) {
            this.tier = tier;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder requires(String... fields) {
            requiredFields.addAll(Arrays.asList(fields));
            return this;
        }

        public Builder escalateTo(String nodeId) {
            this.escalationTarget = nodeId;
            return this;
        }

        public Builder resetsTier() {
            this.resetsTier = true;
            return this;
        }

        public NodeDefinition build() {
            return new NodeDefinition(id, capabilityTag, tier, maxRetries, timeout,
                    requiredFields, escalationTarget, resetsTier);
        }
    }
}

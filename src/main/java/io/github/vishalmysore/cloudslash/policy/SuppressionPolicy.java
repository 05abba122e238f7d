package io.github.vishalmysore.cloudslash.policy;

import io.github.vishalmysore.cloudslash.domain.ResourceNode;

import java.time.Instant;

/**
 * Strategy interface deciding whether a waste finding should be recorded,
 * suppressed, or recorded as justified.
 *
 * The graph consults its policy on every
 * {@link io.github.vishalmysore.cloudslash.graph.ResourceGraph#markWaste} call
 * while holding the write lock, so implementations must not call back into
 * the graph.
 */
public interface SuppressionPolicy {

    /**
     * Evaluate a node that a heuristic wants to flag as waste.
     *
     * @param node the candidate node
     * @param now  the evaluation instant, from the graph's clock
     * @return the decision; never null
     */
    SuppressionDecision evaluate(ResourceNode node, Instant now);

    /**
     * Descriptive name of this policy (for logging/reporting).
     */
    String getName();
}

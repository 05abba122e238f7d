package io.github.vishalmysore.cloudslash.analysis;

import io.github.vishalmysore.cloudslash.domain.ResourceEdge;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;

/**
 * Per-edge gate consulted by {@link ReachabilityAnalyzer} before following an
 * edge. This is the extension point for route table, security group and
 * network ACL evaluation.
 */
public interface TraversalPolicy {

    /**
     * Whether traffic can flow from {@code source} to {@code target} over {@code edge}.
     */
    boolean canTraverse(ResourceNode source, ResourceNode target, ResourceEdge edge);

    /**
     * Descriptive name of this policy (for logging/reporting).
     */
    String getName();
}

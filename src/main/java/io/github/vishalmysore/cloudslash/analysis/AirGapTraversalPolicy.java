package io.github.vishalmysore.cloudslash.analysis;

import io.github.vishalmysore.cloudslash.domain.ResourceEdge;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.domain.ResourceTypes;

/**
 * Minimal network gate: an internet gateway may not reach a node whose
 * {@code NetworkType} property is {@code Private} over a direct edge. VPN
 * gateways terminate inside the network and may reach private nodes. Every
 * other edge is assumed to carry traffic.
 */
public class AirGapTraversalPolicy implements TraversalPolicy {

    public static final String NETWORK_TYPE = "NetworkType";
    public static final String PRIVATE = "Private";

    @Override
    public boolean canTraverse(ResourceNode source, ResourceNode target, ResourceEdge edge) {
        boolean privateTarget = target.getStringProperty(NETWORK_TYPE)
                .map(PRIVATE::equals)
                .orElse(false);
        return !(privateTarget && ResourceTypes.INTERNET_GATEWAY.equals(source.getType()));
    }

    @Override
    public String getName() {
        return "Air gap (internet gateway to private blocked)";
    }
}

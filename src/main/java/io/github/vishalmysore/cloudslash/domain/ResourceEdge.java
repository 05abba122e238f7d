package io.github.vishalmysore.cloudslash.domain;

import lombok.Builder;
import lombok.Data;

/**
 * A directed edge in the resource graph. Forward adjacency stores the edge
 * under its source; reverse adjacency stores the same edge under its target.
 */
@Data
@Builder
public class ResourceEdge {
    private String sourceId;
    private String targetId;
    private EdgeType edgeType;

    @Builder.Default
    private int weight = 1;

    /**
     * Two edges describe the same relationship when source, target and type
     * match; weight is not part of the identity.
     */
    public boolean sameRelationship(String source, String target, EdgeType type) {
        return sourceId.equals(source) && targetId.equals(target) && edgeType == type;
    }

    /**
     * The endpoint on the other side of this edge as seen from {@code nodeId}.
     */
    public String opposite(String nodeId) {
        return sourceId.equals(nodeId) ? targetId : sourceId;
    }
}

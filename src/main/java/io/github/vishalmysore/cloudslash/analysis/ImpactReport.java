package io.github.vishalmysore.cloudslash.analysis;

import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Blast radius of deleting a single node.
 */
@Data
@Builder
public class ImpactReport {
    private ResourceNode targetNode;

    // One forward hop from the target
    @Builder.Default
    private List<ResourceNode> directImpact = new ArrayList<>();

    // Everything further downstream, excluding the direct hop and the target
    @Builder.Default
    private List<ResourceNode> cascadingImpact = new ArrayList<>();

    private int totalRiskScore;

    public int getAffectedCount() {
        return directImpact.size() + cascadingImpact.size();
    }

    /**
     * Affected nodes that are not themselves flagged as waste, i.e. resources
     * still in use that a deletion would touch.
     */
    public List<ResourceNode> getActiveAffected() {
        List<ResourceNode> active = new ArrayList<>();
        for (ResourceNode node : directImpact) {
            if (!node.isWaste()) {
                active.add(node);
            }
        }
        for (ResourceNode node : cascadingImpact) {
            if (!node.isWaste()) {
                active.add(node);
            }
        }
        return active;
    }
}

package io.github.vishalmysore.cloudslash.analysis;

import io.github.vishalmysore.cloudslash.domain.ResourceEdge;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.graph.ResourceGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Read-only blast-radius computation used before confirming a destructive
 * action ("deleting this affects N active resources").
 */
public class ImpactAnalyzer {

    private final ResourceGraph graph;

    public ImpactAnalyzer(ResourceGraph graph) {
        this.graph = graph;
    }

    /**
     * Direct impact is one hop of forward edges; cascading impact is the rest
     * of the forward closure. Each node is reported once and the target never
     * appears in its own report.
     *
     * @return the report, or null when the id is unknown
     */
    public ImpactReport analyzeImpact(String nodeId) {
        return graph.readLocked(() -> {
            ResourceNode target = graph.getNode(nodeId);
            if (target == null) {
                return null;
            }
            ImpactReport report = ImpactReport.builder()
                    .targetNode(target)
                    .build();

            Set<String> visited = new HashSet<>();
            visited.add(nodeId);
            Deque<String> queue = new ArrayDeque<>();
            int risk = 0;

            for (ResourceEdge edge : graph.getEdges(nodeId)) {
                if (visited.add(edge.getTargetId())) {
                    ResourceNode child = graph.getNode(edge.getTargetId());
                    report.getDirectImpact().add(child);
                    risk += child.getRiskScore();
                    queue.add(child.getId());
                }
            }

            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (ResourceEdge edge : graph.getEdges(current)) {
                    if (visited.add(edge.getTargetId())) {
                        ResourceNode node = graph.getNode(edge.getTargetId());
                        report.getCascadingImpact().add(node);
                        risk += node.getRiskScore();
                        queue.add(node.getId());
                    }
                }
            }

            report.setTotalRiskScore(risk);
            return report;
        });
    }
}

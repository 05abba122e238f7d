package io.github.vishalmysore.cloudslash.analysis;

import io.github.vishalmysore.cloudslash.domain.ReachabilityState;
import io.github.vishalmysore.cloudslash.domain.ResourceEdge;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.domain.ResourceTypes;
import io.github.vishalmysore.cloudslash.graph.ResourceGraph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Classifies every node as {@link ReachabilityState#REACHABLE} or
 * {@link ReachabilityState#DARK_MATTER}.
 *
 * One breadth-first flood starts from all ingress nodes (internet and VPN
 * gateways) and follows forward edges that the {@link TraversalPolicy}
 * allows. Nodes the flood never reaches stay dark matter. A dark-matter node
 * flagged as waste is a high-confidence finding; a reachable one may still
 * be serving traffic.
 *
 * By default, uses {@link AirGapTraversalPolicy}.
 */
public class ReachabilityAnalyzer {
    private static final Logger log = Logger.getLogger(ReachabilityAnalyzer.class.getName());

    private final ResourceGraph graph;
    private final TraversalPolicy traversalPolicy;

    public ReachabilityAnalyzer(ResourceGraph graph) {
        this(graph, new AirGapTraversalPolicy());
    }

    public ReachabilityAnalyzer(ResourceGraph graph, TraversalPolicy traversalPolicy) {
        this.graph = graph;
        this.traversalPolicy = traversalPolicy;
    }

    /**
     * Runs the flood over the whole graph under the write lock and updates
     * each node's reachability.
     */
    public ReachabilitySummary analyzeReachability() {
        ReachabilitySummary summary = graph.writeLocked(() -> {
            Deque<String> queue = new ArrayDeque<>();
            Set<String> visited = new HashSet<>();
            int ingress = 0;

            // Seed: ingress points are reachable, everything else starts dark
            for (ResourceNode node : graph.getNodes()) {
                if (ResourceTypes.isIngress(node.getType())) {
                    node.setReachability(ReachabilityState.REACHABLE);
                    visited.add(node.getId());
                    queue.add(node.getId());
                    ingress++;
                } else {
                    node.setReachability(ReachabilityState.DARK_MATTER);
                }
            }

            // Flood along forward edges the policy allows
            while (!queue.isEmpty()) {
                ResourceNode current = graph.getNode(queue.poll());
                for (ResourceEdge edge : graph.getEdges(current.getId())) {
                    if (visited.contains(edge.getTargetId())) {
                        continue;
                    }
                    ResourceNode target = graph.getNode(edge.getTargetId());
                    if (target == null || !traversalPolicy.canTraverse(current, target, edge)) {
                        continue;
                    }
                    target.setReachability(ReachabilityState.REACHABLE);
                    visited.add(target.getId());
                    queue.add(target.getId());
                }
            }

            int total = graph.getNodeCount();
            return ReachabilitySummary.builder()
                    .ingressCount(ingress)
                    .reachableCount(visited.size())
                    .darkMatterCount(total - visited.size())
                    .build();
        });

        log.info("Reachability: " + summary.getReachableCount() + " reachable, "
                + summary.getDarkMatterCount() + " dark matter (" + traversalPolicy.getName() + ")");
        return summary;
    }

    public static boolean isDarkMatter(ResourceNode node) {
        return node.getReachability() == ReachabilityState.DARK_MATTER;
    }
}

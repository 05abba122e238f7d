package io.github.vishalmysore.cloudslash.analysis;

import io.github.vishalmysore.cloudslash.domain.ResourceEdge;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.graph.ResourceGraph;

import java.util.*;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Orders a subset of the graph for sequential deletion.
 *
 * Forward edges point from a dependent to its dependency (instance to
 * subnet to VPC). A depth-first search restricted to the subset appends each
 * node after all of its in-subset dependencies (postorder), which yields
 * dependencies first; that order is then reversed so the result lists
 * dependents before the resources they are attached to. For the chain
 * instance, subnet, VPC the result is {@code [instance, subnet, vpc]}.
 */
public class DependencyOrderer {
    private static final Logger log = Logger.getLogger(DependencyOrderer.class.getName());

    private final ResourceGraph graph;

    public DependencyOrderer(ResourceGraph graph) {
        this.graph = graph;
    }

    /**
     * Returns the subset in safe deletion order. Edges leaving the subset are
     * ignored.
     *
     * @throws CycleDetectedException if the subset contains a dependency cycle;
     *                                no partial order is returned
     */
    public List<ResourceNode> topologicalSort(Collection<ResourceNode> subset) throws CycleDetectedException {
        Map<String, ResourceNode> members = new LinkedHashMap<>();
        for (ResourceNode node : subset) {
            members.putIfAbsent(node.getId(), node);
        }

        List<ResourceNode> sorted;
        try {
            sorted = graph.readLocked(() -> {
                Visit visit = new Visit(members);
                for (ResourceNode node : members.values()) {
                    visit.visit(node.getId());
                }
                return visit.postorder;
            });
        } catch (CycleDetectedException e) {
            log.warning("Deletion ordering aborted: " + e.getMessage());
            throw e;
        }
        Collections.reverse(sorted);
        return sorted;
    }

    /**
     * Id-based variant of {@link #topologicalSort(Collection)}. Unknown ids are skipped.
     */
    public List<String> topologicalSortIds(Collection<String> ids) throws CycleDetectedException {
        List<ResourceNode> subset = ids.stream()
                .map(graph::getNode)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());
        return topologicalSort(subset).stream()
                .map(ResourceNode::getId)
                .collect(Collectors.toList());
    }

    /**
     * Colored depth-first search: in-progress nodes are grey, finished nodes
     * black. Meeting a grey node again means a cycle. An explicit stack of
     * frames keeps long dependency chains off the call stack.
     */
    private class Visit {
        private final Map<String, ResourceNode> members;
        private final Set<String> inProgress = new HashSet<>();
        private final Set<String> finished = new HashSet<>();
        private final List<ResourceNode> postorder = new ArrayList<>();

        Visit(Map<String, ResourceNode> members) {
            this.members = members;
        }

        void visit(String root) throws CycleDetectedException {
            if (finished.contains(root)) {
                return;
            }
            Deque<Frame> stack = new ArrayDeque<>();
            enter(root, stack);
            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (frame.edges.hasNext()) {
                    String next = frame.edges.next().getTargetId();
                    if (!members.containsKey(next) || finished.contains(next)) {
                        continue;
                    }
                    if (inProgress.contains(next)) {
                        throw new CycleDetectedException(next);
                    }
                    enter(next, stack);
                } else {
                    stack.pop();
                    inProgress.remove(frame.id);
                    finished.add(frame.id);
                    postorder.add(members.get(frame.id));
                }
            }
        }

        private void enter(String id, Deque<Frame> stack) {
            inProgress.add(id);
            stack.push(new Frame(id, graph.getEdges(id).iterator()));
        }
    }

    private static final class Frame {
        private final String id;
        private final Iterator<ResourceEdge> edges;

        private Frame(String id, Iterator<ResourceEdge> edges) {
            this.id = id;
            this.edges = edges;
        }
    }
}

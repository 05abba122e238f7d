package io.github.vishalmysore.cloudslash.graph;

import io.github.vishalmysore.cloudslash.domain.EdgeType;
import io.github.vishalmysore.cloudslash.domain.PropertyValue;
import io.github.vishalmysore.cloudslash.domain.ResourceEdge;
import io.github.vishalmysore.cloudslash.domain.ResourceNode;
import io.github.vishalmysore.cloudslash.domain.ResourceTypes;
import io.github.vishalmysore.cloudslash.domain.ScopeError;
import io.github.vishalmysore.cloudslash.policy.IgnoreTagPolicy;
import io.github.vishalmysore.cloudslash.policy.SuppressionDecision;
import io.github.vishalmysore.cloudslash.policy.SuppressionPolicy;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * The in-memory resource dependency graph for a single audit run.
 *
 * Nodes, forward edges and reverse edges are updated together under one
 * {@link ReentrantReadWriteLock}: reads share the lock, writes hold it
 * exclusively. Scanner tasks call the upsert API concurrently during
 * ingestion; analysis routines use {@link #readLocked} or
 * {@link #writeLocked} to see a consistent snapshot for a whole traversal.
 *
 * Waste suppression is delegated to a pluggable {@link SuppressionPolicy}.
 * By default, uses {@link IgnoreTagPolicy} (the {@code cloudslash:ignore} tag).
 */
public class ResourceGraph {
    private static final Logger log = Logger.getLogger(ResourceGraph.class.getName());

    /** Property key heuristics use for a human-readable waste reason. */
    public static final String REASON = "Reason";

    private final Map<String, ResourceNode> nodes = new LinkedHashMap<>();
    private final Map<String, List<ResourceEdge>> edges = new HashMap<>();
    private final Map<String, List<ResourceEdge>> reverseEdges = new HashMap<>();
    private final List<ScopeError> scopeErrors = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final SuppressionPolicy suppressionPolicy;
    private final Clock clock;

    /**
     * Creates a graph with the default tag-driven suppression policy.
     */
    public ResourceGraph() {
        this(new IgnoreTagPolicy());
    }

    public ResourceGraph(SuppressionPolicy suppressionPolicy) {
        this(suppressionPolicy, Clock.systemUTC());
    }

    /**
     * Creates a graph with a custom suppression policy and clock.
     * The clock drives the date and grace-period rules of the policy.
     */
    public ResourceGraph(SuppressionPolicy suppressionPolicy, Clock clock) {
        this.suppressionPolicy = Objects.requireNonNull(suppressionPolicy, "suppressionPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        log.fine("ResourceGraph initialized with suppression: " + suppressionPolicy.getName());
    }

    public SuppressionPolicy getSuppressionPolicy() {
        return suppressionPolicy;
    }

    /**
     * Upserts a node. A new id creates the node; an existing id merges the
     * incoming properties into the node (last writer wins per key) and
     * promotes an {@code Unknown} type to the concrete one. Blank ids are ignored.
     */
    public void addNode(String id, String type, Map<String, PropertyValue> properties) {
        if (id == null || id.isBlank()) {
            return;
        }
        String resolvedType = type == null ? ResourceTypes.UNKNOWN : type;

        lock.writeLock().lock();
        try {
            ResourceNode node = nodes.get(id);
            if (node == null) {
                Map<String, PropertyValue> bag = new HashMap<>();
                if (properties != null) {
                    bag.putAll(properties);
                }
                nodes.put(id, ResourceNode.builder()
                        .id(id)
                        .type(resolvedType)
                        .properties(bag)
                        .build());
                return;
            }
            if (properties != null) {
                node.getProperties().putAll(properties);
            }
            if (ResourceTypes.isUnknown(node.getType()) && !ResourceTypes.isUnknown(resolvedType)) {
                node.setType(resolvedType);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Adds an untyped dependency edge with weight 1.
     */
    public void addEdge(String sourceId, String targetId) {
        addTypedEdge(sourceId, targetId, EdgeType.UNKNOWN, 1);
    }

    /**
     * Adds a typed edge. Endpoints not yet seen are created as {@code Unknown}
     * placeholders so that edges may arrive before their resources' own scans.
     * Duplicate (source, target, type) triples are ignored.
     */
    public void addTypedEdge(String sourceId, String targetId, EdgeType edgeType, int weight) {
        if (sourceId == null || sourceId.isBlank() || targetId == null || targetId.isBlank()) {
            return;
        }
        EdgeType type = edgeType == null ? EdgeType.UNKNOWN : edgeType;

        lock.writeLock().lock();
        try {
            nodes.computeIfAbsent(sourceId, ResourceGraph::placeholder);
            nodes.computeIfAbsent(targetId, ResourceGraph::placeholder);

            List<ResourceEdge> forward = edges.computeIfAbsent(sourceId, k -> new ArrayList<>());
            boolean exists = forward.stream().anyMatch(e -> e.sameRelationship(sourceId, targetId, type));
            if (exists) {
                return;
            }

            ResourceEdge edge = ResourceEdge.builder()
                    .sourceId(sourceId)
                    .targetId(targetId)
                    .edgeType(type)
                    .weight(weight)
                    .build();
            forward.add(edge);
            reverseEdges.computeIfAbsent(targetId, k -> new ArrayList<>()).add(edge);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static ResourceNode placeholder(String id) {
        return ResourceNode.builder()
                .id(id)
                .type(ResourceTypes.UNKNOWN)
                .build();
    }

    /**
     * Flags a node as waste with the given risk score, unless the suppression
     * policy says otherwise. Unknown ids are ignored.
     */
    public void markWaste(String id, int score) {
        markWaste(id, score, null);
    }

    /**
     * Flags a node as waste and records a human-readable reason in the node
     * and in its {@value #REASON} property.
     */
    public void markWaste(String id, int score, String reason) {
        lock.writeLock().lock();
        try {
            ResourceNode node = nodes.get(id);
            if (node == null) {
                return;
            }
            SuppressionDecision decision = suppressionPolicy.evaluate(node, clock.instant());
            switch (decision.getVerdict()) {
                case SUPPRESS:
                    node.setIgnored(true);
                    log.fine("Waste finding suppressed for " + id);
                    return;
                case JUSTIFY:
                    node.setJustified(true);
                    node.setJustification(decision.getJustification());
                    break;
                default:
                    break;
            }
            node.setWaste(true);
            node.setRiskScore(Math.max(0, Math.min(100, score)));
            if (reason != null) {
                node.setWasteReason(reason);
                node.getProperties().put(REASON, PropertyValue.of(reason));
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Applies a mutation to a node under the write lock. Returns false when
     * the id is unknown.
     */
    public boolean updateNode(String id, Consumer<ResourceNode> mutation) {
        lock.writeLock().lock();
        try {
            ResourceNode node = nodes.get(id);
            if (node == null) {
                return false;
            }
            mutation.accept(node);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records a scan failure for a discovery scope and marks the graph partial.
     */
    public void addError(String scope, Throwable error) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        lock.writeLock().lock();
        try {
            scopeErrors.add(new ScopeError(scope, message));
        } finally {
            lock.writeLock().unlock();
        }
        log.warning("Scan scope failed: " + scope + " - " + message);
    }

    public List<ScopeError> getScopeErrors() {
        return readLocked(() -> List.copyOf(scopeErrors));
    }

    /**
     * True when at least one scope failed, so the graph may be missing resources.
     */
    public boolean isPartial() {
        return readLocked(() -> !scopeErrors.isEmpty());
    }

    public ResourceNode getNode(String id) {
        return readLocked(() -> nodes.get(id));
    }

    public boolean containsNode(String id) {
        return readLocked(() -> nodes.containsKey(id));
    }

    /**
     * Snapshot of all nodes in insertion order.
     */
    public List<ResourceNode> getNodes() {
        return readLocked(() -> new ArrayList<>(nodes.values()));
    }

    public List<ResourceNode> getWasteNodes() {
        return readLocked(() -> nodes.values().stream()
                .filter(ResourceNode::isWaste)
                .collect(Collectors.toList()));
    }

    public int getNodeCount() {
        return readLocked(nodes::size);
    }

    public int getEdgeCount() {
        return readLocked(() -> edges.values().stream().mapToInt(List::size).sum());
    }

    /**
     * Outgoing edges of a node (the resources it depends on).
     */
    public List<ResourceEdge> getEdges(String id) {
        return readLocked(() -> List.copyOf(edges.getOrDefault(id, Collections.emptyList())));
    }

    /**
     * Incoming edges of a node (the resources that depend on it).
     */
    public List<ResourceEdge> getReverseEdges(String id) {
        return readLocked(() -> List.copyOf(reverseEdges.getOrDefault(id, Collections.emptyList())));
    }

    /**
     * Ids reachable over one forward edge.
     */
    public List<String> getDownstream(String id) {
        return readLocked(() -> edges.getOrDefault(id, Collections.emptyList()).stream()
                .map(ResourceEdge::getTargetId)
                .collect(Collectors.toList()));
    }

    /**
     * Ids reachable over one reverse edge.
     */
    public List<String> getUpstream(String id) {
        return readLocked(() -> reverseEdges.getOrDefault(id, Collections.emptyList()).stream()
                .map(ResourceEdge::getSourceId)
                .collect(Collectors.toList()));
    }

    /**
     * All nodes connected to the start node, ignoring edge direction.
     * Returns an empty list for an unknown id.
     */
    public List<ResourceNode> getConnectedComponent(String startId) {
        return readLocked(() -> {
            if (!nodes.containsKey(startId)) {
                return Collections.<ResourceNode>emptyList();
            }
            Set<String> visited = new HashSet<>();
            Deque<String> queue = new ArrayDeque<>();
            List<ResourceNode> component = new ArrayList<>();
            queue.add(startId);
            visited.add(startId);

            while (!queue.isEmpty()) {
                String current = queue.poll();
                component.add(nodes.get(current));
                for (ResourceEdge edge : edges.getOrDefault(current, Collections.emptyList())) {
                    if (visited.add(edge.getTargetId())) {
                        queue.add(edge.getTargetId());
                    }
                }
                for (ResourceEdge edge : reverseEdges.getOrDefault(current, Collections.emptyList())) {
                    if (visited.add(edge.getSourceId())) {
                        queue.add(edge.getSourceId());
                    }
                }
            }
            return component;
        });
    }

    public boolean areConnected(String firstId, String secondId) {
        return readLocked(() -> getConnectedComponent(firstId).stream()
                .anyMatch(n -> n.getId().equals(secondId)));
    }

    /**
     * Runs an action while holding the shared lock for its whole duration.
     * The lock is reentrant, so the graph's own accessors may be called inside.
     */
    public <T, E extends Exception> T readLocked(LockedAction<T, E> action) throws E {
        lock.readLock().lock();
        try {
            return action.run();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs an action while holding the exclusive lock for its whole duration.
     * Read accessors may be called inside; the write lock admits its holder.
     */
    public <T, E extends Exception> T writeLocked(LockedAction<T, E> action) throws E {
        lock.writeLock().lock();
        try {
            return action.run();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public String dumpStats() {
        return readLocked(() -> String.format("Nodes: %d | Edges: %d | Scope errors: %d",
                nodes.size(), getEdgeCount(), scopeErrors.size()));
    }

    /**
     * Work performed while a graph lock is held. May throw a checked exception,
     * which is propagated after the lock is released.
     */
    @FunctionalInterface
    public interface LockedAction<T, E extends Exception> {
        T run() throws E;
    }
}

package io.github.vishalmysore.cloudslash.analysis;

/**
 * Thrown when a node subset cannot be ordered because its dependencies form a
 * cycle. Callers must treat the whole subset as unorderable.
 */
public class CycleDetectedException extends Exception {

    private final String nodeId;

    public CycleDetectedException(String nodeId) {
        super("cycle detected involving " + nodeId);
        this.nodeId = nodeId;
    }

    /**
     * The node at which the traversal re-entered an in-progress node.
     */
    public String getNodeId() {
        return nodeId;
    }
}

package io.github.vishalmysore.cloudslash.swarm;

/**
 * A unit of discovery work, typically one provider API call that writes its
 * results into the resource graph.
 */
@FunctionalInterface
public interface SwarmTask {

    /**
     * Runs the task. Any exception is delivered to the future returned by
     * {@link AdaptiveScheduler#submit}; a rate-limit failure should be
     * recognizable by the scheduler's {@link ThrottleClassifier}.
     */
    void execute(ScanContext context) throws Exception;
}

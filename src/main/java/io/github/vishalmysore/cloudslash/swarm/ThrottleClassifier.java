package io.github.vishalmysore.cloudslash.swarm;

/**
 * Decides whether a task failure is a provider throttling signal, which makes
 * the scheduler back off.
 */
@FunctionalInterface
public interface ThrottleClassifier {

    boolean isThrottled(Throwable error);
}

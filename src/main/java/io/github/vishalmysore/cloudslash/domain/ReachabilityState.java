package io.github.vishalmysore.cloudslash.domain;

/**
 * Network reachability classification assigned by the reachability analysis.
 */
public enum ReachabilityState {
    UNKNOWN, // Analysis has not run yet
    REACHABLE, // A traffic path exists from an ingress point
    DARK_MATTER // No discoverable path from any ingress point
}

package io.github.vishalmysore.cloudslash.swarm;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time view of the scheduler, for progress displays.
 */
@Value
@Builder
public class SchedulerStats {
    int activeWorkers;
    int concurrency;
    long tasksCompleted;
    long tasksFailed;
    int queuedTasks;
}

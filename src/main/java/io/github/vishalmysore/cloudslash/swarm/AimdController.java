package io.github.vishalmysore.cloudslash.swarm;

import java.time.Clock;
import java.time.Duration;
import java.util.logging.Logger;

/**
 * Additive Increase, Multiplicative Decrease controller for the scheduler's
 * worker count.
 *
 * A throttled task halves the target (never below the minimum); a fast,
 * successful task adds {@value #ADDITIVE_STEP} workers (never above the
 * maximum). Adjustments are spaced at least {@link #COOLDOWN} apart, counted
 * from construction for the first one.
 */
public class AimdController {
    private static final Logger log = Logger.getLogger(AimdController.class.getName());

    public static final Duration COOLDOWN = Duration.ofMillis(100);
    public static final Duration LOW_LATENCY = Duration.ofMillis(100);
    public static final int ADDITIVE_STEP = 5;

    private final int minWorkers;
    private final int maxWorkers;
    private final Clock clock;

    private int concurrency;
    private long lastChangeMillis;

    public AimdController(int start, int minWorkers, int maxWorkers) {
        this(start, minWorkers, maxWorkers, Clock.systemUTC());
    }

    public AimdController(int start, int minWorkers, int maxWorkers, Clock clock) {
        if (minWorkers < 1 || maxWorkers < minWorkers) {
            throw new IllegalArgumentException(
                    "invalid worker bounds: min=" + minWorkers + ", max=" + maxWorkers);
        }
        this.minWorkers = minWorkers;
        this.maxWorkers = maxWorkers;
        this.clock = clock;
        this.concurrency = clamp(start);
        this.lastChangeMillis = clock.millis();
    }

    public synchronized int getConcurrency() {
        return concurrency;
    }

    public int getMinWorkers() {
        return minWorkers;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    /**
     * Feeds the outcome of one task back into the controller.
     *
     * @param latency   wall-clock duration of the task
     * @param throttled whether the provider rate-limited the task
     */
    public synchronized void feedback(Duration latency, boolean throttled) {
        long now = clock.millis();
        if (now - lastChangeMillis < COOLDOWN.toMillis()) {
            return;
        }

        if (throttled) {
            int previous = concurrency;
            concurrency = Math.max(minWorkers, concurrency / 2);
            lastChangeMillis = now;
            log.fine("Throttled: concurrency " + previous + " -> " + concurrency);
            return;
        }

        if (latency.compareTo(LOW_LATENCY) < 0) {
            concurrency = Math.min(maxWorkers, concurrency + ADDITIVE_STEP);
            lastChangeMillis = now;
        }
    }

    private int clamp(int value) {
        return Math.max(minWorkers, Math.min(maxWorkers, value));
    }
}

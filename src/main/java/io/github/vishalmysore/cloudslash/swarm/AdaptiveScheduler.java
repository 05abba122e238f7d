package io.github.vishalmysore.cloudslash.swarm;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.github.vishalmysore.cloudslash.config.AuditConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dynamically sized worker pool that tunes its own parallelism.
 *
 * Tasks wait in a fixed-capacity queue; a full queue blocks the submitter
 * until a slot frees or the scheduler stops.
 * A control loop ticks every {@value #CONTROL_TICK_MILLIS} ms and spawns
 * workers up to the {@link AimdController}'s target. Each worker retires on
 * its own once the live count exceeds the target, so shrinking is gradual.
 * After every task the worker reports latency and throttling to the
 * controller.
 *
 * Task failures are delivered only through the future returned by
 * {@link #submit}. Anything thrown by a task, including unchecked
 * exceptions and errors, is caught at the worker so the worker survives.
 */
public class AdaptiveScheduler {
    private static final Logger log = Logger.getLogger(AdaptiveScheduler.class.getName());

    public static final long CONTROL_TICK_MILLIS = 50;
    public static final long IDLE_SLEEP_MILLIS = 10;
    // How often a blocked submitter re-checks for shutdown
    private static final long OFFER_POLL_MILLIS = 50;

    private static final ThreadFactory CONTROL_THREADS = new ThreadFactoryBuilder()
            .setNameFormat("swarm-control")
            .setDaemon(true)
            .build();
    private static final ThreadFactory WORKER_THREADS = new ThreadFactoryBuilder()
            .setNameFormat("swarm-worker-%d")
            .setDaemon(true)
            .build();

    private final AimdController aimd;
    private final BlockingQueue<QueuedTask> queue;
    private final ThrottleClassifier throttleClassifier;

    private final AtomicInteger liveWorkers = new AtomicInteger();
    private final AtomicLong tasksCompleted = new AtomicLong();
    private final AtomicLong tasksFailed = new AtomicLong();
    private final Set<Thread> workers = ConcurrentHashMap.newKeySet();

    private volatile boolean shutdown;
    private volatile ScanContext context;
    private ScheduledExecutorService controlLoop;

    /**
     * Creates a scheduler with the default bounds (start 50, min 5, max 500,
     * queue 1000).
     */
    public AdaptiveScheduler() {
        this(AuditConfig.defaults());
    }

    public AdaptiveScheduler(AuditConfig config) {
        this(new AimdController(config.getStartWorkers(), config.getMinWorkers(), config.getMaxWorkers()),
                config.getQueueCapacity(), new RateLimitThrottleClassifier());
    }

    public AdaptiveScheduler(AimdController aimd, int queueCapacity, ThrottleClassifier throttleClassifier) {
        this.aimd = aimd;
        this.queue = new ArrayBlockingQueue<>(queueCapacity);
        this.throttleClassifier = throttleClassifier;
    }

    public AimdController getAimd() {
        return aimd;
    }

    /**
     * Enqueues a task, blocking while the queue is full.
     *
     * @return a future completed when the task finishes, exceptionally with
     *         whatever the task threw, or cancelled if the scheduler stops
     *         before running it
     * @throws InterruptedException  if interrupted while waiting for space
     * @throws IllegalStateException if the scheduler is stopped, including
     *                               while the caller was waiting for space
     */
    public CompletableFuture<Void> submit(SwarmTask task) throws InterruptedException {
        CompletableFuture<Void> future = new CompletableFuture<>();
        QueuedTask queued = new QueuedTask(task, future);
        do {
            if (shutdown) {
                throw new IllegalStateException("scheduler is stopped");
            }
        } while (!queue.offer(queued, OFFER_POLL_MILLIS, TimeUnit.MILLISECONDS));

        // stop() may have drained the queue before this task landed in it
        if (shutdown && queue.remove(queued)) {
            future.cancel(false);
        }
        return future;
    }

    /**
     * Starts the control loop. Cancelling {@code scanContext} stops the loop
     * and lets idle workers exit.
     */
    public synchronized void start(ScanContext scanContext) {
        if (controlLoop != null) {
            throw new IllegalStateException("scheduler already started");
        }
        if (shutdown) {
            throw new IllegalStateException("scheduler is stopped");
        }
        this.context = scanContext;
        this.controlLoop = Executors.newSingleThreadScheduledExecutor(CONTROL_THREADS);
        controlLoop.scheduleAtFixedRate(this::tick, 0, CONTROL_TICK_MILLIS, TimeUnit.MILLISECONDS);
        log.info("Swarm started: concurrency " + aimd.getConcurrency()
                + " (min " + aimd.getMinWorkers() + ", max " + aimd.getMaxWorkers() + ")");
    }

    /**
     * Signals shutdown and blocks until every live worker has exited. Tasks
     * still queued are cancelled, and submitters blocked on a full queue are
     * rejected.
     */
    public void stop() throws InterruptedException {
        shutdown = true;
        ScheduledExecutorService loop;
        synchronized (this) {
            loop = controlLoop;
        }
        if (loop != null) {
            loop.shutdownNow();
            loop.awaitTermination(1, TimeUnit.SECONDS);
        }
        for (Thread worker : new ArrayList<>(workers)) {
            worker.join();
        }

        List<QueuedTask> abandoned = new ArrayList<>();
        queue.drainTo(abandoned);
        for (QueuedTask queued : abandoned) {
            queued.future.cancel(false);
        }
        log.info("Swarm stopped: " + tasksCompleted.get() + " tasks completed, "
                + tasksFailed.get() + " failed, " + abandoned.size() + " abandoned");
    }

    public SchedulerStats getStats() {
        return SchedulerStats.builder()
                .activeWorkers(liveWorkers.get())
                .concurrency(aimd.getConcurrency())
                .tasksCompleted(tasksCompleted.get())
                .tasksFailed(tasksFailed.get())
                .queuedTasks(queue.size())
                .build();
    }

    private void tick() {
        try {
            if (shutdown || context.isCancelled()) {
                controlLoop.shutdown();
                return;
            }
            int target = aimd.getConcurrency();
            int current = liveWorkers.get();
            if (current < target) {
                for (int i = 0; i < target - current; i++) {
                    spawnWorker();
                }
                log.fine("Scaled up: " + current + " -> " + target + " workers");
            }
        } catch (RuntimeException e) {
            log.log(Level.SEVERE, "Swarm control loop tick failed", e);
        }
    }

    private void spawnWorker() {
        liveWorkers.incrementAndGet();
        Thread worker = WORKER_THREADS.newThread(this::workerLoop);
        workers.add(worker);
        worker.start();
    }

    private void workerLoop() {
        boolean retired = false;
        try {
            while (!shutdown && !context.isCancelled()) {
                int live = liveWorkers.get();
                if (live > aimd.getConcurrency()) {
                    // Only one worker per surplus slot may retire
                    if (liveWorkers.compareAndSet(live, live - 1)) {
                        retired = true;
                        return;
                    }
                    continue;
                }

                QueuedTask next = queue.poll();
                if (next == null) {
                    try {
                        Thread.sleep(IDLE_SLEEP_MILLIS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return;
                    }
                    continue;
                }
                run(next);
            }
        } finally {
            if (!retired) {
                liveWorkers.decrementAndGet();
            }
            workers.remove(Thread.currentThread());
        }
    }

    private void run(QueuedTask queued) {
        long start = System.nanoTime();
        Throwable failure = null;
        try {
            queued.task.execute(context);
        } catch (Throwable t) {
            failure = t;
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - start);

        boolean throttled = failure != null && throttleClassifier.isThrottled(failure);
        aimd.feedback(latency, throttled);

        tasksCompleted.incrementAndGet();
        if (failure == null) {
            queued.future.complete(null);
        } else {
            tasksFailed.incrementAndGet();
            queued.future.completeExceptionally(failure);
        }
    }

    private static final class QueuedTask {
        private final SwarmTask task;
        private final CompletableFuture<Void> future;

        private QueuedTask(SwarmTask task, CompletableFuture<Void> future) {
            this.task = task;
            this.future = future;
        }
    }
}

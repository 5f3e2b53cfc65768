package villagecompute.scheduler.services;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool that executes dispatched jobs.
 *
 * <p>
 * Two executors are kept apart:
 * <ul>
 * <li><b>workers</b> - fixed size ({@code scheduler.worker-pool-size}); each worker drives one job end to end, so at
 * most that many jobs are in flight and a burst of due jobs queues instead of exhausting connections</li>
 * <li><b>runners</b> - run template bodies so a worker can stop waiting when the timeout elapses; a timed-out body
 * keeps its runner thread until it returns</li>
 * </ul>
 */
@ApplicationScoped
public class JobWorkerPool {

    private static final Logger LOG = Logger.getLogger(JobWorkerPool.class);

    private final int size;
    private final ThreadPoolExecutor workers;
    private final ExecutorService runners;

    @Inject
    public JobWorkerPool(@ConfigProperty(
            name = "scheduler.worker-pool-size",
            defaultValue = "4") int size) {
        if (size < 1) {
            throw new IllegalArgumentException("scheduler.worker-pool-size must be at least 1, got " + size);
        }
        this.size = size;
        this.workers = new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(),
                namedThreads("job-worker", false));
        this.runners = Executors.newCachedThreadPool(namedThreads("job-runner", true));
        LOG.infof("Initialized JobWorkerPool with %d workers", size);
    }

    /**
     * Queues a job run. Returns immediately.
     *
     * @throws java.util.concurrent.RejectedExecutionException
     *             after {@link #shutdown()}
     */
    public Future<?> submit(Runnable task) {
        return workers.submit(task);
    }

    /**
     * Starts a template body on a runner thread.
     */
    public <T> Future<T> runTemplate(Callable<T> body) {
        return runners.submit(body);
    }

    public int size() {
        return size;
    }

    public int activeCount() {
        return workers.getActiveCount();
    }

    public int queuedCount() {
        return workers.getQueue().size();
    }

    public boolean isShutdown() {
        return workers.isShutdown();
    }

    /**
     * Stops accepting work and waits briefly for in-flight jobs. Template bodies still running are interrupted.
     */
    @PreDestroy
    public void shutdown() {
        LOG.infof("Shutting down JobWorkerPool (active: %d, queued: %d)", activeCount(), queuedCount());
        workers.shutdown();
        try {
            if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not drain within 30s, interrupting remaining jobs");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        runners.shutdownNow();
    }

    private static ThreadFactory namedThreads(String prefix, boolean daemon) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(daemon);
            return thread;
        };
    }
}

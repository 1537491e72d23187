package fun.fengwk.lds.core.service.browser.runtime;

import fun.fengwk.lds.core.service.browser.BrowserProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker manager with blocking queue and per-worker browser.
 *
 * <p>Workers are spawned lazily up to the configured maximum and retire after
 * staying idle longer than the configured ttl, never dropping below the minimum.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class BrowserWorkerManager {

    private final BrowserProperties browserProperties;
    private final BrowserSessionFactory browserSessionFactory;
    private final BlockingQueue<TaskHolder<?>> queue;
    private final List<Thread> workerThreads = new CopyOnWriteArrayList<>();
    private final AtomicInteger workerIdGen = new AtomicInteger(1);
    private final AtomicInteger workerCount = new AtomicInteger(0);
    private final AtomicInteger idleWorkers = new AtomicInteger(0);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    @Autowired
    public BrowserWorkerManager(BrowserProperties browserProperties) {
        this(browserProperties, () -> new PlaywrightBrowserSession(browserProperties), false);
    }

    BrowserWorkerManager(BrowserProperties browserProperties, BrowserSessionFactory browserSessionFactory) {
        this(browserProperties, browserSessionFactory, true);
    }

    private BrowserWorkerManager(BrowserProperties browserProperties,
                                 BrowserSessionFactory browserSessionFactory,
                                 boolean preheat) {
        this.browserProperties = browserProperties;
        this.browserSessionFactory = browserSessionFactory;
        int capacity = Math.max(1, browserProperties.getRequestQueueCapacity());
        this.queue = new LinkedBlockingQueue<>(capacity);
        if (preheat) {
            startMinWorkers();
        }
    }

    public <T> T execute(BrowserTask<T> task) {
        if (shutdown.get()) {
            throw new IllegalStateException("worker pool is shutdown");
        }
        TaskHolder<T> holder = new TaskHolder<>(task);
        try {
            // Browsers launch on first use so that a run rejected by input validation never starts one.
            if (workerCount.get() == 0) {
                startMinWorkers();
            }
            boolean offered = queue.offer(
                holder,
                browserProperties.getQueueOfferTimeoutMs(),
                TimeUnit.MILLISECONDS
            );
            if (!offered) {
                log.warn("worker queue full, size={}, capacity={}", queue.size(), browserProperties.getRequestQueueCapacity());
                throw new IllegalStateException("worker pool is busy");
            }
            ensureWorkerCapacity();
            return holder.future.get();
        } catch (IllegalStateException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("worker execution interrupted");
            throw new IllegalStateException("browser worker execution interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            log.warn("worker execution failed, error={}", cause.getMessage());
            throw new IllegalStateException("browser worker execution failed: " + cause.getMessage(), cause);
        }
    }

    int workerCount() {
        return workerCount.get();
    }

    private void startMinWorkers() {
        int minSize = normalizeMinWorkerSize();
        for (int i = 0; i < minSize; i++) {
            spawnWorker();
        }
    }

    private void ensureWorkerCapacity() {
        if (shutdown.get()) {
            return;
        }
        if (idleWorkers.get() > 0) {
            return;
        }
        int maxSize = normalizeMaxWorkerSize();
        while (workerCount.get() < maxSize && idleWorkers.get() == 0 && queue.size() > 0) {
            spawnWorker();
        }
    }

    private void spawnWorker() {
        int maxSize = normalizeMaxWorkerSize();
        int current = workerCount.get();
        if (current >= maxSize) {
            return;
        }
        if (!workerCount.compareAndSet(current, current + 1)) {
            return;
        }
        int workerId = workerIdGen.getAndIncrement();
        Thread thread = new Thread(new Worker(workerId));
        thread.setName("lds-browser-worker-" + workerId);
        thread.setDaemon(true);
        workerThreads.add(thread);
        thread.start();
    }

    private int normalizeMinWorkerSize() {
        return Math.max(browserProperties.getWorkerPoolMinSizePerProcess(), 1);
    }

    private int normalizeMaxWorkerSize() {
        return Math.max(browserProperties.getWorkerPoolMaxSizePerProcess(), normalizeMinWorkerSize());
    }

    private long normalizeRefreshIntervalMs() {
        return Math.max(1L, browserProperties.getWorkerRefreshIntervalMs());
    }

    private boolean shouldTerminate(long lastTaskAt) {
        long idleTtlMs = browserProperties.getWorkerIdleTtlMs();
        if (idleTtlMs <= 0) {
            return false;
        }
        if (System.currentTimeMillis() - lastTaskAt < idleTtlMs) {
            return false;
        }
        return workerCount.get() > normalizeMinWorkerSize();
    }

    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        List<TaskHolder<?>> pending = new ArrayList<>();
        queue.drainTo(pending);
        for (TaskHolder<?> holder : pending) {
            holder.future.completeExceptionally(new IllegalStateException("worker pool is shutting down"));
        }
        for (Thread thread : workerThreads) {
            thread.interrupt();
        }
    }

    private static class TaskHolder<T> {

        private final BrowserTask<T> task;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        private TaskHolder(BrowserTask<T> task) {
            this.task = task;
        }

    }

    private class Worker implements Runnable {

        private final int workerId;
        private long lastTaskAt = System.currentTimeMillis();
        private BrowserSession browserSession;

        private Worker(int workerId) {
            this.workerId = workerId;
        }

        @Override
        public void run() {
            Exception failure = null;
            try {
                browserSession = browserSessionFactory.create();
                loop();
            } catch (Exception ex) {
                log.warn("worker terminated unexpectedly, id={}", workerId, ex);
                failure = ex;
            } finally {
                closeBrowser();
                workerCount.decrementAndGet();
                workerThreads.remove(Thread.currentThread());
            }
            if (failure != null) {
                failPendingIfLastWorker(failure);
            }
        }

        private void loop() {
            long refreshIntervalMs = normalizeRefreshIntervalMs();
            while (!shutdown.get()) {
                TaskHolder<?> holder;
                idleWorkers.incrementAndGet();
                try {
                    holder = queue.poll(refreshIntervalMs, TimeUnit.MILLISECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                } finally {
                    idleWorkers.decrementAndGet();
                }
                if (holder == null) {
                    if (shouldTerminate(lastTaskAt)) {
                        return;
                    }
                    continue;
                }
                lastTaskAt = System.currentTimeMillis();
                executeTask(holder);
            }
        }

        private <T> void executeTask(TaskHolder<T> holder) {
            try {
                T result = browserSession.run(workerId, holder.task);
                holder.future.complete(result);
            } catch (Exception ex) {
                log.warn("worker task failed, id={}, error={}", workerId, ex.getMessage());
                holder.future.completeExceptionally(ex);
            }
        }

        private void failPendingIfLastWorker(Exception cause) {
            // Runs after the decrement: a task offered later sees no worker and spawns one itself.
            if (workerCount.get() > 0) {
                return;
            }
            List<TaskHolder<?>> pending = new ArrayList<>();
            queue.drainTo(pending);
            for (TaskHolder<?> holder : pending) {
                holder.future.completeExceptionally(cause);
            }
        }

        private void closeBrowser() {
            if (browserSession != null) {
                try {
                    browserSession.close();
                } catch (Exception ex) {
                    log.debug("failed to close browser, id={}, error={}", workerId, ex.getMessage());
                }
            }
        }

    }

    interface BrowserSessionFactory {

        BrowserSession create();

    }

    interface BrowserSession extends AutoCloseable {

        <T> T run(int workerId, BrowserTask<T> task) throws Exception;

        @Override
        void close();

    }

}

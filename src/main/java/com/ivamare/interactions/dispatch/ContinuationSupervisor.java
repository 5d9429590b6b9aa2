package com.ivamare.interactions.dispatch;

import com.ivamare.interactions.exception.InteractionsException;
import com.ivamare.interactions.handler.InteractionHandler;
import com.ivamare.interactions.model.InteractionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs handler tasks and background continuations.
 *
 * <p>Handler tasks are exposed as futures and never cancelled. Continuations are
 * fire-and-forget: every exception they raise is caught, counted and logged here,
 * so nothing escapes to the serving thread.
 */
public class ContinuationSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ContinuationSupervisor.class);

    private final ExecutorService executor;
    private final Duration shutdownTimeout;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicInteger inFlightCount = new AtomicInteger(0);
    private final AtomicLong completedCount = new AtomicLong(0);
    private final AtomicLong failedCount = new AtomicLong(0);

    public ContinuationSupervisor() {
        this(Duration.ofSeconds(10));
    }

    public ContinuationSupervisor(Duration shutdownTimeout) {
        this(Executors.newCachedThreadPool(daemonThreads()), shutdownTimeout);
    }

    /**
     * Creates a supervisor on a caller-supplied executor.
     *
     * @param executor executor for handler tasks and continuations; must not bound the
     *                 number of threads, since continuations block on handler tasks
     * @param shutdownTimeout how long {@link #close()} waits for in-flight work
     */
    public ContinuationSupervisor(ExecutorService executor, Duration shutdownTimeout) {
        this.executor = executor;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Launch a handler as an independent task.
     *
     * @param handler handler routine
     * @param context interaction passed to the handler
     * @return future completed with the handler's return value or failure
     * @throws InteractionsException if the supervisor is stopped
     */
    public CompletableFuture<Object> launch(InteractionHandler handler, InteractionContext context) {
        if (!running.get()) {
            throw new InteractionsException("Continuation supervisor is stopped");
        }

        CompletableFuture<Object> task = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    task.complete(handler.handle(context));
                } catch (Throwable t) {
                    task.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            throw new InteractionsException("Continuation supervisor rejected handler task", e);
        }
        return task;
    }

    /**
     * Run a continuation in the background. Failures are logged, never rethrown.
     *
     * @param description short description for logs
     * @param continuation the work
     * @return false if the continuation was dropped without running
     */
    public boolean supervise(String description, Continuation continuation) {
        if (!running.get()) {
            failedCount.incrementAndGet();
            log.warn("Continuation supervisor is stopped, dropping {}", description);
            return false;
        }

        inFlightCount.incrementAndGet();
        try {
            executor.execute(() -> {
                try {
                    continuation.run();
                    completedCount.incrementAndGet();
                } catch (Exception e) {
                    failedCount.incrementAndGet();
                    log.error("Background continuation {} failed", description, e);
                } finally {
                    inFlightCount.decrementAndGet();
                }
            });
        } catch (RejectedExecutionException e) {
            inFlightCount.decrementAndGet();
            failedCount.incrementAndGet();
            log.error("Background continuation {} rejected", description, e);
            return false;
        }
        return true;
    }

    /**
     * Stop accepting work and wait for in-flight work to finish.
     *
     * @param timeout maximum time to wait
     * @return future that completes when the executor has terminated
     */
    public CompletableFuture<Void> stop(Duration timeout) {
        if (!running.getAndSet(false)) {
            return CompletableFuture.completedFuture(null);
        }

        log.info("Stopping continuation supervisor, waiting for {} in-flight continuations", inFlightCount.get());
        executor.shutdown();

        return CompletableFuture.runAsync(() -> {
            try {
                if (!executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Timeout waiting for {} in-flight continuations", inFlightCount.get());
                    executor.shutdownNow();
                }
                log.info("Continuation supervisor stopped");
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        });
    }

    public void stopNow() {
        running.set(false);
        executor.shutdownNow();
    }

    @Override
    public void close() {
        stop(shutdownTimeout).join();
    }

    public boolean isRunning() {
        return running.get();
    }

    public int inFlightCount() {
        return inFlightCount.get();
    }

    public long completedCount() {
        return completedCount.get();
    }

    public long failedCount() {
        return failedCount.get();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "interaction-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Background work that may throw.
     */
    @FunctionalInterface
    public interface Continuation {
        void run() throws Exception;
    }
}

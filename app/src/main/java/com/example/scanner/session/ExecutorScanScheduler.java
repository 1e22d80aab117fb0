package com.example.scanner.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link ScanScheduler} backed by a single-threaded scheduled executor.
 */
public class ExecutorScanScheduler implements ScanScheduler {
    private static final Logger log = LoggerFactory.getLogger(ExecutorScanScheduler.class);

    private final ScheduledThreadPoolExecutor executor;

    public ExecutorScanScheduler(String threadName) {
        this.executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            return thread;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public void execute(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler shut down, task dropped");
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMs) {
        try {
            ScheduledFuture<?> future = executor.schedule(guarded(task), delayMs, TimeUnit.MILLISECONDS);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("Scheduler shut down, timer of {} ms dropped", delayMs);
            return () -> false;
        }
    }

    @Override
    public void shutdown() {
        executor.shutdown();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("❌ Session task failed", e);
            }
        };
    }
}

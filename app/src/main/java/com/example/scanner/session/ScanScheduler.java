package com.example.scanner.session;

/**
 * The single thread a scan session runs on. Every state mutation and every
 * timer of a session goes through its scheduler.
 */
public interface ScanScheduler {

    void execute(Runnable task);

    ScheduledTask schedule(Runnable task, long delayMs);

    /**
     * Stops accepting work. Pending delayed tasks are dropped.
     */
    void shutdown();

    interface ScheduledTask {
        /**
         * @return true if the task had not run yet and will now never run
         */
        boolean cancel();
    }
}

package com.example.scanner.session;

import java.util.PriorityQueue;

/**
 * Deterministic scheduler on a virtual clock. Nothing runs until the test
 * calls {@link #runUntilIdle()} or {@link #advanceBy(long)}.
 */
public class ManualScanScheduler implements ScanScheduler {

    private static class Entry implements Comparable<Entry> {
        final long dueAt;
        final long seq;
        final Runnable task;

        Entry(long dueAt, long seq, Runnable task) {
            this.dueAt = dueAt;
            this.seq = seq;
            this.task = task;
        }

        @Override
        public int compareTo(Entry o) {
            int byTime = Long.compare(dueAt, o.dueAt);
            return byTime != 0 ? byTime : Long.compare(seq, o.seq);
        }
    }

    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private long now = 0;
    private long seq = 0;
    private boolean shutdown = false;

    @Override
    public void execute(Runnable task) {
        if (!shutdown) {
            queue.add(new Entry(now, seq++, task));
        }
    }

    @Override
    public ScheduledTask schedule(Runnable task, long delayMs) {
        if (shutdown) {
            return () -> false;
        }
        Entry entry = new Entry(now + delayMs, seq++, task);
        queue.add(entry);
        return () -> queue.remove(entry);
    }

    @Override
    public void shutdown() {
        shutdown = true;
        queue.removeIf(e -> e.dueAt > now);
    }

    public boolean isShutdown() {
        return shutdown;
    }

    public long now() {
        return now;
    }

    public int pendingTasks() {
        return queue.size();
    }

    public void runUntilIdle() {
        while (!queue.isEmpty() && queue.peek().dueAt <= now) {
            queue.poll().task.run();
        }
    }

    public void advanceBy(long ms) {
        long target = now + ms;
        while (!queue.isEmpty() && queue.peek().dueAt <= target) {
            Entry next = queue.poll();
            now = next.dueAt;
            next.task.run();
        }
        now = target;
    }
}

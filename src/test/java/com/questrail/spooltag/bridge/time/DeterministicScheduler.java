package com.questrail.spooltag.bridge.time;

import com.questrail.spooltag.bridge.internal.time.Cancellable;
import com.questrail.spooltag.bridge.internal.time.MonotonicClock;
import com.questrail.spooltag.bridge.internal.time.MonotonicScheduler;

import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deterministic scheduler driven by a ManualMonotonicClock.
 *
 * Tasks execute ONLY when {@link #runDueTasks()} is called.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final MonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence = 0;

    public DeterministicScheduler(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run all tasks whose deadlines are <= current clock time, including tasks
     * those tasks schedule if they are already due.
     */
    public void runDueTasks() {
        while (true) {
            Scheduled next;
            synchronized (this) {
                if (queue.isEmpty() || queue.peek().deadlineNanos > clock.nowNanos()) {
                    return;
                }
                next = queue.poll();
            }
            if (!next.cancelled.get()) {
                next.task.run();
            }
        }
    }

    /** Tasks scheduled and not yet cancelled or run. */
    public synchronized int pendingCount() {
        return (int) queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long order;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long order, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.order = order;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int c = Long.compare(this.deadlineNanos, o.deadlineNanos);
            return c != 0 ? c : Long.compare(this.order, o.order);
        }
    }
}

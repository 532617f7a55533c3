package com.questrail.spooltag.bridge.internal.exec;

import com.questrail.spooltag.bridge.internal.events.BridgeEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeTimeoutEvent;
import com.questrail.spooltag.bridge.internal.state.BridgeIntents;
import com.questrail.spooltag.bridge.internal.time.Cancellable;
import com.questrail.spooltag.bridge.internal.time.MonotonicScheduler;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * TimedBridgeIntentExecutor
 * =============================================================================
 * Wrapper that adds request deadlines to an existing {@link BridgeIntentExecutor}.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>After a {@code SEND_REQUEST} is delegated, arms a timer at the
 *       request's monotonic deadline.</li>
 *   <li>When the armed request completes or fails, the timer is cancelled.</li>
 *   <li>An expired timer injects a {@link BridgeTimeoutEvent.RequestTimeout};
 *       the reducer decides whether it is still relevant.</li>
 * </ul>
 *
 * <p>Only one timer is armed at a time, matching the session's single-flight
 * rule.</p>
 */
public final class TimedBridgeIntentExecutor implements BridgeIntentExecutor {

    private final BridgeIntentExecutor delegate;
    private final Consumer<BridgeEvent> eventSink;
    private final MonotonicScheduler scheduler;
    private final Supplier<Instant> wallClock;

    // Stale scheduled tasks compare against this and do nothing.
    private final AtomicLong lastArmedSequence = new AtomicLong(0);
    private volatile long armedSequenceSnapshot = 0;
    private volatile Cancellable armedTimeout = null;
    private volatile String armedRequestId = null;

    public TimedBridgeIntentExecutor(BridgeIntentExecutor delegate,
                                     Consumer<BridgeEvent> eventSink,
                                     MonotonicScheduler scheduler,
                                     Supplier<Instant> wallClock)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.eventSink = Objects.requireNonNull(eventSink, "eventSink");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public void execute(BridgeIntents intents)
    {
        Objects.requireNonNull(intents, "intents");

        for (BridgeIntents.Intent intent : intents.intents()) {
            String resolved = resolvedRequestId(intent);
            if (resolved != null && resolved.equals(armedRequestId)) {
                cancelArmedTimeout();
            }
        }

        delegate.execute(intents);

        intents.first(BridgeIntents.SendRequest.class)
                .ifPresent(send -> armTimeout(send.request().requestId(), send.deadlineNanos()));
    }

    /** Id of the armed request, if any. */
    public String armedRequestId() {
        return armedRequestId;
    }

    private static String resolvedRequestId(BridgeIntents.Intent intent) {
        if (intent instanceof BridgeIntents.CompleteRead c) {
            return c.requestId();
        }
        if (intent instanceof BridgeIntents.CompleteWrite c) {
            return c.requestId();
        }
        if (intent instanceof BridgeIntents.FailRequest f) {
            return f.requestId();
        }
        return null;
    }

    private void cancelArmedTimeout() {
        Cancellable prior = armedTimeout;
        if (prior != null) {
            prior.cancel();
            armedTimeout = null;
        }
        armedSequenceSnapshot = 0;
        armedRequestId = null;
    }

    private void armTimeout(String requestId, long deadlineNanos)
    {
        cancelArmedTimeout();

        long seq = lastArmedSequence.incrementAndGet();
        armedSequenceSnapshot = seq;
        armedRequestId = requestId;

        armedTimeout = scheduler.scheduleAtNanos(deadlineNanos, () -> onTimeout(seq, requestId));
    }

    private void onTimeout(long seq, String requestId)
    {
        if (seq != armedSequenceSnapshot) {
            return;
        }

        // Timestamp is observational only.
        eventSink.accept(new BridgeTimeoutEvent.RequestTimeout(wallClock.get(), requestId));
    }
}

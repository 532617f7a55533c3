package com.questrail.spooltag.bridge.internal.exec;

import com.questrail.spooltag.bridge.internal.events.BridgeEvent;
import com.questrail.spooltag.bridge.internal.state.BridgeSessionState;
import com.questrail.spooltag.bridge.internal.state.BridgeStateReducer;
import com.questrail.spooltag.bridge.internal.time.SystemWallClock;
import com.questrail.spooltag.bridge.observability.BridgeErrorEvent;
import com.questrail.spooltag.bridge.observability.BridgeObservabilitySink;
import com.questrail.spooltag.bridge.observability.BridgeStateTransitionEvent;
import com.questrail.spooltag.bridge.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * BridgeOperationalDriver
 * =============================================================================
 * Serialized event loop of the bridge session.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Serialized event processing (one event at a time)</li>
 *   <li>State management (holds the current {@link BridgeSessionState})</li>
 *   <li>Reducer coordination and intent execution</li>
 * </ul>
 *
 * <h2>Threading Model</h2>
 * Events from any thread (callers, Netty, timers) go into one queue. A drain
 * task runs on the supplied loop {@link Executor} and processes the queue until
 * it is empty; at most one drain task exists at a time. Production passes a
 * single named thread. Tests pass {@code Runnable::run}, in which case the
 * submitting thread drains, and events submitted while draining (for example
 * by an executor reacting to an intent) are picked up by the same loop instead
 * of recursing.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()           → accepts events
 *   driver.submitEvent(...)  → enqueues and schedules a drain
 *   driver.stop()            → stops accepting and discards queued events
 * </pre>
 * The loop executor is owned by the caller.
 */
public final class BridgeOperationalDriver {

    private final BridgeStateReducer reducer;
    private final BridgeIntentExecutor executor;
    private final Supplier<BridgeSessionState> initialStateSupplier;
    private final BridgeObservabilitySink observabilitySink;
    private final Executor loopExecutor;

    private final Queue<BridgeEvent> eventQueue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final Object stateLock = new Object();

    private volatile BridgeSessionState currentState;

    /**
     * @param reducer              reducer for state transitions
     * @param executor             executor for intents (typically {@link TimedBridgeIntentExecutor})
     * @param initialStateSupplier supplies the state installed on {@link #start()}
     * @param observabilitySink    may be null
     * @param loopExecutor         runs drain tasks
     */
    public BridgeOperationalDriver(BridgeStateReducer reducer,
                                   BridgeIntentExecutor executor,
                                   Supplier<BridgeSessionState> initialStateSupplier,
                                   BridgeObservabilitySink observabilitySink,
                                   Executor loopExecutor)
    {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.initialStateSupplier = Objects.requireNonNull(initialStateSupplier, "initialStateSupplier");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.loopExecutor = Objects.requireNonNull(loopExecutor, "loopExecutor");

        this.currentState = initialStateSupplier.get();
    }

    /**
     * Idempotent.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            synchronized (stateLock) {
                currentState = initialStateSupplier.get();
            }
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            eventQueue.clear();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Submits an event for processing. Events are processed in submission
     * order. Ignored while stopped.
     *
     * @param event the event to process (must not be null)
     */
    public void submitEvent(BridgeEvent event) {
        Objects.requireNonNull(event, "event");
        if (!running.get()) {
            return;
        }
        eventQueue.offer(event);
        scheduleDrain();
    }

    /**
     * Thread-safe snapshot of the current state.
     */
    public BridgeSessionState currentState() {
        synchronized (stateLock) {
            return currentState;
        }
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            loopExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            observabilitySink.onError(new BridgeErrorEvent(
                SystemWallClock.INSTANCE.now(),
                "Event loop rejected drain task",
                e
            ));
        }
    }

    private void drain() {
        try {
            BridgeEvent event;
            while (running.get() && (event = eventQueue.poll()) != null) {
                try {
                    processEvent(event);
                } catch (RuntimeException e) {
                    observabilitySink.onError(new BridgeErrorEvent(
                        SystemWallClock.INSTANCE.now(),
                        "Event processing error",
                        e
                    ));
                }
            }
        } finally {
            draining.set(false);
        }

        // An event may have been queued after the last poll but before the flag was cleared.
        if (running.get() && !eventQueue.isEmpty()) {
            scheduleDrain();
        }
    }

    /**
     * Apply via reducer, then execute resulting intents.
     */
    private void processEvent(BridgeEvent event) {
        final BridgeSessionState oldState;
        final BridgeStateReducer.Result result;

        synchronized (stateLock) {
            oldState = currentState;
            result = reducer.apply(currentState, event);
            currentState = result.newState();
        }

        observabilitySink.onStateTransition(new BridgeStateTransitionEvent(
            SystemWallClock.INSTANCE.now(),
            oldState,
            result.newState(),
            event,
            result.intents()
        ));

        if (!result.intents().isEmpty()) {
            executor.execute(result.intents());
        }
    }
}

package com.questrail.spooltag.bridge.transport;

import com.questrail.spooltag.bridge.internal.time.Cancellable;
import com.questrail.spooltag.bridge.internal.time.MonotonicClock;
import com.questrail.spooltag.bridge.internal.time.MonotonicScheduler;
import com.questrail.spooltag.bridge.internal.time.SystemWallClock;
import com.questrail.spooltag.bridge.observability.BridgeObservabilitySink;
import com.questrail.spooltag.bridge.observability.BridgeTransportObservabilityEvent;
import com.questrail.spooltag.bridge.observability.NullObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * ReconnectingMessageChannel
 * =============================================================================
 * Decorator that restarts a {@link MessageChannel} after it goes down.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>After every unexpected down (including a failed connect) a reconnect
 *       is scheduled after a fixed delay. Attempts continue indefinitely.</li>
 *   <li>At most one reconnect is pending at any time.</li>
 *   <li>After {@link #stop()} no reconnect happens, and a pending one is
 *       cancelled.</li>
 * </ul>
 *
 * <p>All lifecycle callbacks are forwarded unchanged to the registered
 * listener; the session sees every down and fails its pending request.</p>
 */
public final class ReconnectingMessageChannel implements MessageChannel
{
    private final MessageChannel delegate;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration reconnectDelay;
    private final BridgeObservabilitySink observabilitySink;

    private final AtomicBoolean stopped = new AtomicBoolean(true);
    private final AtomicReference<Cancellable> pendingReconnect = new AtomicReference<>();

    private volatile MessageChannelListener listener;

    public ReconnectingMessageChannel(MessageChannel delegate,
                                      MonotonicScheduler scheduler,
                                      MonotonicClock clock,
                                      Duration reconnectDelay,
                                      BridgeObservabilitySink observabilitySink)
    {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        this.delegate.setListener(new ForwardingListener());
    }

    @Override
    public void setListener(MessageChannelListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (listener == null) {
            throw new IllegalStateException("MessageChannelListener must be set before start()");
        }
        if (stopped.compareAndSet(true, false)) {
            delegate.start();
        }
    }

    @Override
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            Cancellable pending = pendingReconnect.getAndSet(null);
            if (pending != null) {
                pending.cancel();
            }
            delegate.stop();
        }
    }

    @Override
    public boolean send(String text) {
        return delegate.send(text);
    }

    @Override
    public boolean isOpen() {
        return delegate.isOpen();
    }

    /** True while a reconnect is scheduled but has not run. */
    public boolean isReconnectPending() {
        return pendingReconnect.get() != null;
    }

    private void scheduleReconnect() {
        if (stopped.get()) {
            return;
        }

        // Reserve the slot first so two downs never schedule two reconnects.
        Cancellable placeholder = () -> false;
        if (!pendingReconnect.compareAndSet(null, placeholder)) {
            return;
        }

        Cancellable scheduled = scheduler.scheduleAfter(reconnectDelay, clock, () -> {
            pendingReconnect.set(null);
            if (!stopped.get()) {
                delegate.start();
            }
        });
        if (!pendingReconnect.compareAndSet(placeholder, scheduled)) {
            // Ran already (zero delay) or stop() cleared the slot.
            if (stopped.get()) {
                scheduled.cancel();
            }
        }

        observabilitySink.onTransportEvent(new BridgeTransportObservabilityEvent(
                SystemWallClock.INSTANCE.now(),
                BridgeTransportObservabilityEvent.Kind.RECONNECT_SCHEDULED,
                "reconnect in " + reconnectDelay));
    }

    private final class ForwardingListener implements MessageChannelListener
    {
        @Override
        public void onChannelUp() {
            MessageChannelListener l = listener;
            if (l != null) {
                l.onChannelUp();
            }
        }

        @Override
        public void onChannelDown(Throwable cause) {
            MessageChannelListener l = listener;
            if (l != null) {
                l.onChannelDown(cause);
            }
            scheduleReconnect();
        }

        @Override
        public void onMessage(String text) {
            MessageChannelListener l = listener;
            if (l != null) {
                l.onMessage(text);
            }
        }
    }
}

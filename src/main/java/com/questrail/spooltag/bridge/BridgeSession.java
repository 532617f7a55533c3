package com.questrail.spooltag.bridge;

import com.questrail.spooltag.bridge.config.BridgeRuntimeConfig;
import com.questrail.spooltag.bridge.internal.decode.BridgeMessageDecoder;
import com.questrail.spooltag.bridge.internal.encode.BridgeMessageEncoder;
import com.questrail.spooltag.bridge.internal.events.BridgeEvent;
import com.questrail.spooltag.bridge.internal.events.BridgeRequestEvent;
import com.questrail.spooltag.bridge.internal.exec.BridgeOperationalDriver;
import com.questrail.spooltag.bridge.internal.exec.PendingCompletions;
import com.questrail.spooltag.bridge.internal.exec.TimedBridgeIntentExecutor;
import com.questrail.spooltag.bridge.internal.state.BridgeSessionState;
import com.questrail.spooltag.bridge.internal.state.BridgeStateReducer;
import com.questrail.spooltag.bridge.internal.state.PendingRequest;
import com.questrail.spooltag.bridge.internal.time.MonotonicClock;
import com.questrail.spooltag.bridge.internal.time.MonotonicScheduler;
import com.questrail.spooltag.bridge.internal.time.ScheduledExecutorScheduler;
import com.questrail.spooltag.bridge.internal.time.SystemMonotonicClock;
import com.questrail.spooltag.bridge.internal.time.SystemWallClock;
import com.questrail.spooltag.bridge.internal.time.WallClock;
import com.questrail.spooltag.bridge.observability.BridgeObservabilitySink;
import com.questrail.spooltag.bridge.observability.Slf4jBridgeObservabilitySink;
import com.questrail.spooltag.bridge.transport.BridgeTransportAdapter;
import com.questrail.spooltag.bridge.transport.MessageChannel;
import com.questrail.spooltag.bridge.transport.ReconnectingMessageChannel;
import com.questrail.spooltag.bridge.transport.TransportBridgeIntentExecutor;
import com.questrail.spooltag.bridge.transport.websocket.netty.NettyWebSocketChannel;
import com.questrail.spooltag.codec.impl.DefaultFilamentTagDecoder;
import com.questrail.spooltag.crypto.KeyDerivation;
import com.questrail.spooltag.tag.KeySet;
import com.questrail.spooltag.tag.TagImage;
import com.questrail.spooltag.tag.TagUid;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * BridgeSession
 * =============================================================================
 * Composition root, lifecycle owner and initiator API of a tag bridge session.
 *
 * <p>The session asks a remote tag agent to read or write the next tag held to
 * its reader. Every operation returns a {@link CompletableFuture} and never
 * blocks the calling thread. Only one request may be awaiting a tag at a time;
 * a second one fails with {@link BridgeRequestException.Reason#REQUEST_IN_PROGRESS}.</p>
 *
 * <h2>Wiring</h2>
 * <pre>
 *   MessageChannel (reconnecting) ⇄ BridgeTransportAdapter
 *        → BridgeOperationalDriver → BridgeStateReducer
 *            → TimedBridgeIntentExecutor → TransportBridgeIntentExecutor
 * </pre>
 */
public final class BridgeSession {
    private final BridgeRuntimeConfig config;
    private final BridgeOperationalDriver driver;
    private final BridgeTransportAdapter transport;
    private final PendingCompletions completions;
    private final KeyDerivation keyDerivation;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Supplier<String> requestIds;
    private final List<ExecutorService> ownedExecutors;

    private BridgeSession(BridgeRuntimeConfig config,
                          BridgeOperationalDriver driver,
                          BridgeTransportAdapter transport,
                          PendingCompletions completions,
                          KeyDerivation keyDerivation,
                          MonotonicClock clock,
                          WallClock wallClock,
                          Supplier<String> requestIds,
                          List<ExecutorService> ownedExecutors) {
        this.config = config;
        this.driver = driver;
        this.transport = transport;
        this.completions = completions;
        this.keyDerivation = keyDerivation;
        this.clock = clock;
        this.wallClock = wallClock;
        this.requestIds = requestIds;
        this.ownedExecutors = ownedExecutors;
    }

    public void start() {
        driver.start();
        transport.start();
    }

    public void stop() {
        transport.stop();
        driver.stop();
        completions.failAll(new BridgeRequestException(
                BridgeRequestException.Reason.NO_BRIDGE_CONNECTED, "session stopped"));

        for (ExecutorService executor : ownedExecutors) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public BridgeSessionState currentState() {
        return driver.currentState();
    }

    public boolean isConnected() {
        return driver.currentState().isConnected();
    }

    // -------------------------------------------------------------------------
    // Reads
    // -------------------------------------------------------------------------

    /** Read with the configured default timeout; the agent derives keys. */
    public CompletableFuture<TagReadResult> requestRead() {
        return requestRead(config.timingPolicy().defaultRequestTimeout());
    }

    /** Read the next tag; the agent derives the keys from the uid it sees. */
    public CompletableFuture<TagReadResult> requestRead(Duration timeout) {
        return submitRead(Optional.empty(), timeout);
    }

    /**
     * Read a tag whose uid is already known, sending keys derived here.
     */
    public CompletableFuture<TagReadResult> requestRead(Duration timeout, TagUid expected) {
        Objects.requireNonNull(expected, "expected");
        return submitRead(Optional.of(keyDerivation.derive(expected)), timeout);
    }

    // -------------------------------------------------------------------------
    // Writes
    // -------------------------------------------------------------------------

    /**
     * Write {@code target} with keys derived from the uid in its block 0.
     * The agent never writes block 0 or sector trailers.
     */
    public CompletableFuture<WriteOutcome> requestWrite(TagImage target, Duration timeout) {
        Objects.requireNonNull(target, "target");
        return requestWrite(target, keyDerivation.derive(target.uid()), timeout);
    }

    public CompletableFuture<WriteOutcome> requestWrite(TagImage target, KeySet keys, Duration timeout) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(keys, "keys");
        return submitWrite(keys, target, Optional.empty(), timeout);
    }

    /**
     * Copy the payload of a previously read tag onto the next tag presented.
     *
     * @param sourceUid   uid of the tag {@code sourceImage} was read from; keys
     *                    are derived from it
     * @param rewriteUid  also ask the agent to give the blank the source uid;
     *                    refused with {@code UNSUPPORTED_OPERATION} unless the
     *                    runtime is configured as uid-rewrite capable
     */
    public CompletableFuture<WriteOutcome> requestClone(TagUid sourceUid,
                                                        TagImage sourceImage,
                                                        Duration timeout,
                                                        boolean rewriteUid) {
        Objects.requireNonNull(sourceUid, "sourceUid");
        Objects.requireNonNull(sourceImage, "sourceImage");
        Objects.requireNonNull(timeout, "timeout");

        if (rewriteUid && !config.uidRewriteSupported()) {
            return CompletableFuture.failedFuture(new BridgeRequestException(
                    BridgeRequestException.Reason.UNSUPPORTED_OPERATION,
                    "agent hardware cannot rewrite tag uid"));
        }

        return submitWrite(keyDerivation.derive(sourceUid),
                sourceImage.payloadOnly(),
                rewriteUid ? Optional.of(sourceUid) : Optional.empty(),
                timeout);
    }

    // -------------------------------------------------------------------------

    private CompletableFuture<TagReadResult> submitRead(Optional<KeySet> keys, Duration timeout) {
        long deadline = deadline(timeout);
        String id = requestIds.get();
        CompletableFuture<TagReadResult> future = completions.registerRead(id);
        submit(PendingRequest.read(id, keys, timeout, deadline));
        return future;
    }

    private CompletableFuture<WriteOutcome> submitWrite(KeySet keys,
                                                        TagImage payload,
                                                        Optional<TagUid> targetUid,
                                                        Duration timeout) {
        long deadline = deadline(timeout);
        String id = requestIds.get();
        CompletableFuture<WriteOutcome> future = completions.registerWrite(id);
        submit(PendingRequest.write(id, keys, payload, targetUid, timeout, deadline));
        return future;
    }

    private void submit(PendingRequest request) {
        if (!driver.isRunning()) {
            completions.fail(request.requestId(), new BridgeRequestException(
                    BridgeRequestException.Reason.NO_BRIDGE_CONNECTED, "session not started"));
            return;
        }
        driver.submitEvent(new BridgeRequestEvent.RequestSubmitted(wallClock.now(), request));
    }

    private long deadline(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        return clock.nowNanos() + timeout.toNanos();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeRuntimeConfig config;
        private MessageChannel channel;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private Executor loopExecutor;
        private BridgeObservabilitySink observabilitySink = new Slf4jBridgeObservabilitySink();
        private Supplier<String> requestIds;
        private Consumer<TagUid> tagDetectedListener = uid -> {};

        public Builder withConfig(BridgeRuntimeConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Channel to the agent. Defaults to a Netty WebSocket client for the
         * configured endpoint. Either way it is wrapped for reconnection.
         */
        public Builder withChannel(MessageChannel channel) {
            this.channel = channel;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /** Runs the event loop. Defaults to a dedicated thread. */
        public Builder withLoopExecutor(Executor loopExecutor) {
            this.loopExecutor = loopExecutor;
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /** Defaults to a decimal counter starting at 1. */
        public Builder withRequestIds(Supplier<String> requestIds) {
            this.requestIds = requestIds;
            return this;
        }

        public Builder withTagDetectedListener(Consumer<TagUid> listener) {
            this.tagDetectedListener = listener;
            return this;
        }

        public BridgeSession build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(tagDetectedListener, "tagDetectedListener");

            List<ExecutorService> owned = new ArrayList<>();

            // 1. Time
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ScheduledExecutorService timerExec = Executors.newSingleThreadScheduledExecutor(
                        r -> daemon(r, "bridge-session-timer"));
                owned.add(timerExec);
                effectiveScheduler = new ScheduledExecutorScheduler(timerExec, clock);
            }

            Executor effectiveLoop = loopExecutor;
            if (effectiveLoop == null) {
                ExecutorService loopExec = Executors.newSingleThreadExecutor(
                        r -> daemon(r, "bridge-session-driver"));
                owned.add(loopExec);
                effectiveLoop = loopExec;
            }

            Supplier<String> ids = requestIds;
            if (ids == null) {
                AtomicLong counter = new AtomicLong();
                ids = () -> Long.toString(counter.incrementAndGet());
            }

            // 2. Transport
            MessageChannel raw = channel != null ? channel : new NettyWebSocketChannel(config.endpoint().uri());
            MessageChannel reconnecting = new ReconnectingMessageChannel(
                    raw, effectiveScheduler, clock, config.timingPolicy().reconnectDelay(), observabilitySink);

            // Circular dependency: executors and adapter submit to the driver built last.
            AtomicReference<BridgeOperationalDriver> driverRef = new AtomicReference<>();
            Consumer<BridgeEvent> events = event -> driverRef.get().submitEvent(event);

            BridgeTransportAdapter adapter = new BridgeTransportAdapter(
                    reconnecting,
                    events,
                    new BridgeMessageDecoder(),
                    new BridgeMessageEncoder(),
                    wallClock,
                    observabilitySink);

            // 3. Execution
            PendingCompletions completions = new PendingCompletions();
            TransportBridgeIntentExecutor transportExecutor = new TransportBridgeIntentExecutor(
                    adapter,
                    completions,
                    new DefaultFilamentTagDecoder(),
                    events,
                    tagDetectedListener,
                    wallClock,
                    observabilitySink);
            TimedBridgeIntentExecutor timedExecutor = new TimedBridgeIntentExecutor(
                    transportExecutor,
                    events,
                    effectiveScheduler,
                    wallClock::now);

            // 4. Event loop
            BridgeOperationalDriver driver = new BridgeOperationalDriver(
                    new BridgeStateReducer(),
                    timedExecutor,
                    () -> BridgeSessionState.initial(wallClock.now()),
                    observabilitySink,
                    effectiveLoop);
            driverRef.set(driver);

            return new BridgeSession(
                    config,
                    driver,
                    adapter,
                    completions,
                    new KeyDerivation(config.keyDerivation()),
                    clock,
                    wallClock,
                    ids,
                    List.copyOf(owned));
        }

        private static Thread daemon(Runnable r, String name) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}

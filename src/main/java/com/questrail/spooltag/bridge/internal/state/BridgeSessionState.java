package com.questrail.spooltag.bridge.internal.state;

import com.questrail.spooltag.tag.TagUid;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * BridgeSessionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of a bridge session.
 *
 * <h2>Phases</h2>
 * <pre>
 *   IDLE  --request accepted-->  AWAITING_TAG  --response / failure / timeout-->  IDLE
 * </pre>
 * At most one {@link PendingRequest} exists; the phase is derived from it.
 *
 * <p>Connection state, the agent's reported device name and the last detected
 * uid are tracked alongside. All transitions go through
 * {@link BridgeStateReducer}.</p>
 */
public final class BridgeSessionState
{
    public enum Connection {
        DISCONNECTED,
        CONNECTED
    }

    public enum Phase {
        IDLE,
        AWAITING_TAG
    }

    private final Connection connection;
    private final String agentDevice;
    private final PendingRequest pending;
    private final TagUid lastDetectedUid;
    private final Instant lastTransitionAt;

    private BridgeSessionState(Connection connection,
                               String agentDevice,
                               PendingRequest pending,
                               TagUid lastDetectedUid,
                               Instant lastTransitionAt)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.agentDevice = agentDevice;
        this.pending = pending;
        this.lastDetectedUid = lastDetectedUid;
        this.lastTransitionAt = Objects.requireNonNull(lastTransitionAt, "lastTransitionAt");
    }

    /** Disconnected and idle. */
    public static BridgeSessionState initial(Instant now) {
        return new BridgeSessionState(Connection.DISCONNECTED, null, null, null, now);
    }

    public Connection connection() {
        return connection;
    }

    public boolean isConnected() {
        return connection == Connection.CONNECTED;
    }

    public Phase phase() {
        return pending == null ? Phase.IDLE : Phase.AWAITING_TAG;
    }

    public Optional<PendingRequest> pending() {
        return Optional.ofNullable(pending);
    }

    public Optional<String> agentDevice() {
        return Optional.ofNullable(agentDevice);
    }

    public Optional<TagUid> lastDetectedUid() {
        return Optional.ofNullable(lastDetectedUid);
    }

    public Instant lastTransitionAt() {
        return lastTransitionAt;
    }

    /** True if {@code requestId} names the pending request. */
    public boolean isPending(String requestId) {
        return pending != null && pending.requestId().equals(requestId);
    }

    // ---------------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------------

    public BridgeSessionState withConnection(Connection connection, Instant now) {
        String device = connection == Connection.CONNECTED ? agentDevice : null;
        return new BridgeSessionState(connection, device, pending, lastDetectedUid, now);
    }

    public BridgeSessionState withAgentDevice(String device, Instant now) {
        return new BridgeSessionState(connection, device, pending, lastDetectedUid, now);
    }

    public BridgeSessionState withPending(PendingRequest request, Instant now) {
        Objects.requireNonNull(request, "request");
        return new BridgeSessionState(connection, agentDevice, request, lastDetectedUid, now);
    }

    public BridgeSessionState withoutPending(Instant now) {
        return new BridgeSessionState(connection, agentDevice, null, lastDetectedUid, now);
    }

    public BridgeSessionState withLastDetectedUid(TagUid uid, Instant now) {
        return new BridgeSessionState(connection, agentDevice, pending, uid, now);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BridgeSessionState that)) return false;
        return connection == that.connection
                && Objects.equals(agentDevice, that.agentDevice)
                && Objects.equals(pending, that.pending)
                && Objects.equals(lastDetectedUid, that.lastDetectedUid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(connection, agentDevice, pending, lastDetectedUid);
    }

    @Override
    public String toString() {
        return "BridgeSessionState[" + connection + ", " + phase()
                + (pending != null ? " " + pending.requestId() : "") + "]";
    }
}

package com.questrail.spooltag.bridge.model;

/**
 * BridgeMessage
 * =============================================================================
 * Semantic message exchanged between the bridge session (initiator) and the
 * remote agent.
 *
 * <h2>Direction</h2>
 * <ul>
 *   <li>{@link BridgeRequest}: initiator to agent</li>
 *   <li>{@link AgentMessage}: agent to initiator</li>
 * </ul>
 *
 * <p>Messages are immutable values. Their JSON envelope form lives in
 * {@code bridge.internal.encode} and {@code bridge.internal.decode}; nothing in
 * this package knows about JSON.</p>
 */
public sealed interface BridgeMessage permits BridgeRequest, AgentMessage
{
    BridgeAction action();
}

package com.questrail.spooltag.bridge.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * BridgeTimingPolicy
 * -----------------------------------------------------------------------------
 * Operational timing configuration for the bridge session.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>defaultRequestTimeout</b>: how long a request waits for a tag when
 *       the caller does not pass a timeout.</li>
 *   <li><b>reconnectDelay</b>: fixed pause between an unexpected channel loss
 *       and the next connection attempt.</li>
 * </ul>
 *
 * <p>These values control scheduling only. Whether a request fails is always
 * decided by the reducer.</p>
 */
public record BridgeTimingPolicy(
        Duration defaultRequestTimeout,
        Duration reconnectDelay
) {
    public BridgeTimingPolicy {
        Objects.requireNonNull(defaultRequestTimeout, "defaultRequestTimeout");
        Objects.requireNonNull(reconnectDelay, "reconnectDelay");

        if (defaultRequestTimeout.isNegative() || defaultRequestTimeout.isZero()) {
            throw new IllegalArgumentException("defaultRequestTimeout must be positive");
        }
        if (reconnectDelay.isNegative()) {
            throw new IllegalArgumentException("reconnectDelay must be non-negative");
        }
    }

    /**
     * Policy with the given request timeout and the default reconnect delay.
     */
    public static BridgeTimingPolicy withRequestTimeout(Duration defaultRequestTimeout) {
        return new BridgeTimingPolicy(defaultRequestTimeout, defaults().reconnectDelay());
    }

    /**
     * <ul>
     *   <li>defaultRequestTimeout: 30s</li>
     *   <li>reconnectDelay: 5s</li>
     * </ul>
     */
    public static BridgeTimingPolicy defaults() {
        return new BridgeTimingPolicy(Duration.ofSeconds(30), Duration.ofSeconds(5));
    }
}

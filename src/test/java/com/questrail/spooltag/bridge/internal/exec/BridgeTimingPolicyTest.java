package com.questrail.spooltag.bridge.internal.exec;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BridgeTimingPolicyTest {

    @Test
    void defaults() {
        BridgeTimingPolicy p = BridgeTimingPolicy.defaults();
        assertEquals(Duration.ofSeconds(30), p.defaultRequestTimeout());
        assertEquals(Duration.ofSeconds(5), p.reconnectDelay());
    }

    @Test
    void withRequestTimeoutKeepsReconnectDelay() {
        BridgeTimingPolicy p = BridgeTimingPolicy.withRequestTimeout(Duration.ofSeconds(3));
        assertEquals(Duration.ofSeconds(3), p.defaultRequestTimeout());
        assertEquals(Duration.ofSeconds(5), p.reconnectDelay());
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new BridgeTimingPolicy(Duration.ZERO, Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> new BridgeTimingPolicy(Duration.ofSeconds(1), Duration.ofSeconds(-1)));
    }
}

package com.questrail.spooltag.bridge.config;

import com.questrail.spooltag.bridge.internal.exec.BridgeTimingPolicy;
import com.questrail.spooltag.crypto.KeyDerivationConfig;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.junit.jupiter.api.Assertions.*;

class BridgeRuntimeConfigTest {

    @Test
    void endpointDefaultsToWebSocketPath() {
        BridgeEndpointConfig e = BridgeEndpointConfig.of("192.168.1.20", 8765);
        assertEquals(URI.create("ws://192.168.1.20:8765/ws/nfc"), e.uri());
        assertFalse(e.isSecure());
        assertTrue(new BridgeEndpointConfig(URI.create("wss://bridge.local/ws/nfc")).isSecure());
    }

    @Test
    void endpointRejectsOtherSchemes() {
        assertThrows(IllegalArgumentException.class, () -> new BridgeEndpointConfig(URI.create("http://host/ws")));
        assertThrows(IllegalArgumentException.class, () -> BridgeEndpointConfig.of("host", 0));
    }

    @Test
    void builderDefaults() {
        BridgeRuntimeConfig c = BridgeRuntimeConfig.builder()
                .withEndpoint(BridgeEndpointConfig.of("localhost", 8765))
                .build();

        assertEquals(BridgeTimingPolicy.defaults(), c.timingPolicy());
        assertFalse(c.uidRewriteSupported());
        assertArrayEquals(KeyDerivationConfig.defaults().masterSecret(), c.keyDerivation().masterSecret());
    }

    @Test
    void endpointIsRequired() {
        assertThrows(NullPointerException.class, () -> BridgeRuntimeConfig.builder().build());
    }
}

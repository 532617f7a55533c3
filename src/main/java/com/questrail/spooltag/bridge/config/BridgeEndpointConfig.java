package com.questrail.spooltag.bridge.config;

import java.net.URI;
import java.util.Objects;

/**
 * Location of the tag agent's WebSocket endpoint.
 *
 * @param uri {@code ws://} or {@code wss://} URI with a host
 */
public record BridgeEndpointConfig(URI uri)
{
    public static final String DEFAULT_PATH = "/ws/nfc";

    public BridgeEndpointConfig {
        Objects.requireNonNull(uri, "uri");
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("ws") || scheme.equalsIgnoreCase("wss"))) {
            throw new IllegalArgumentException("endpoint must be a ws:// or wss:// URI: " + uri);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("endpoint has no host: " + uri);
        }
    }

    /**
     * Plain WebSocket endpoint at {@link #DEFAULT_PATH}.
     */
    public static BridgeEndpointConfig of(String host, int port) {
        Objects.requireNonNull(host, "host");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        return new BridgeEndpointConfig(URI.create("ws://" + host + ":" + port + DEFAULT_PATH));
    }

    public boolean isSecure() {
        return uri.getScheme().equalsIgnoreCase("wss");
    }
}

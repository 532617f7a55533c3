package com.questrail.spooltag.bridge.config;

import com.questrail.spooltag.bridge.internal.exec.BridgeTimingPolicy;
import com.questrail.spooltag.crypto.KeyDerivationConfig;

import java.util.Objects;

/**
 * Aggregated configuration for a bridge session.
 *
 * @param endpoint            where the agent listens
 * @param timingPolicy        request timeout and reconnect delay
 * @param keyDerivation       secret used to derive sector keys locally
 * @param uidRewriteSupported whether the agent's hardware can rewrite a tag
 *                            identifier; clone requests asking for a rewrite
 *                            are refused up front when it cannot
 */
public record BridgeRuntimeConfig(
    BridgeEndpointConfig endpoint,
    BridgeTimingPolicy timingPolicy,
    KeyDerivationConfig keyDerivation,
    boolean uidRewriteSupported
) {
    public BridgeRuntimeConfig {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(keyDerivation, "keyDerivation");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private BridgeEndpointConfig endpoint;
        private BridgeTimingPolicy timingPolicy = BridgeTimingPolicy.defaults();
        private KeyDerivationConfig keyDerivation = KeyDerivationConfig.defaults();
        private boolean uidRewriteSupported = false;

        public Builder withEndpoint(BridgeEndpointConfig endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder withTimingPolicy(BridgeTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withKeyDerivation(KeyDerivationConfig keyDerivation) {
            this.keyDerivation = keyDerivation;
            return this;
        }

        public Builder withUidRewriteSupported(boolean supported) {
            this.uidRewriteSupported = supported;
            return this;
        }

        public BridgeRuntimeConfig build() {
            return new BridgeRuntimeConfig(endpoint, timingPolicy, keyDerivation, uidRewriteSupported);
        }
    }
}

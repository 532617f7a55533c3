package com.questrail.spooltag.agent;

import com.questrail.spooltag.crypto.KeyDerivationConfig;
import com.questrail.spooltag.tag.SectorKey;

import java.util.List;
import java.util.Objects;

/**
 * Configuration of a tag agent.
 *
 * @param deviceName    reported in {@code STATUS}
 * @param fallbackKeys  tried as key A, in order, on sectors the request's key
 *                      does not open
 * @param keyDerivation used when a read request carries no keys
 */
public record AgentConfig(
    String deviceName,
    List<SectorKey> fallbackKeys,
    KeyDerivationConfig keyDerivation
) {
    /** Factory default, MAD and NFC Forum keys. */
    public static final List<SectorKey> WELL_KNOWN_KEYS = List.of(
            SectorKey.fromHex("FFFFFFFFFFFF"),
            SectorKey.fromHex("A0A1A2A3A4A5"),
            SectorKey.fromHex("D3F7D3F7D3F7"));

    public AgentConfig {
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(keyDerivation, "keyDerivation");
        fallbackKeys = List.copyOf(Objects.requireNonNull(fallbackKeys, "fallbackKeys"));
        if (deviceName.isBlank()) {
            throw new IllegalArgumentException("deviceName must not be blank");
        }
    }

    public static AgentConfig defaults() {
        return new AgentConfig("spooltag-agent", WELL_KNOWN_KEYS, KeyDerivationConfig.defaults());
    }

    public AgentConfig withDeviceName(String deviceName) {
        return new AgentConfig(deviceName, fallbackKeys, keyDerivation);
    }

    public AgentConfig withFallbackKeys(List<SectorKey> fallbackKeys) {
        return new AgentConfig(deviceName, fallbackKeys, keyDerivation);
    }
}

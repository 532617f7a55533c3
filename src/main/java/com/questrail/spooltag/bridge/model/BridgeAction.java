package com.questrail.spooltag.bridge.model;

import java.util.Optional;

/**
 * Envelope {@code action} discriminator and its wire spelling.
 */
public enum BridgeAction
{
    READ_TAG,
    WRITE_TAG,
    STATUS,
    TAG_DETECTED,
    TAG_DATA,
    WRITE_RESULT,
    ERROR;

    public String wireName() {
        return name();
    }

    public static Optional<BridgeAction> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (BridgeAction a : values()) {
            if (a.wireName().equals(name)) {
                return Optional.of(a);
            }
        }
        return Optional.empty();
    }
}

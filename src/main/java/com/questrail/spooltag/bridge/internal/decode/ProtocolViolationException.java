package com.questrail.spooltag.bridge.internal.decode;

import java.util.Optional;

/**
 * Indicates that an inbound envelope could not be translated into a valid
 * {@code BridgeMessage}.
 *
 * This typically reflects:
 * <ul>
 *   <li>Malformed JSON or a non-object document</li>
 *   <li>Missing or unknown {@code action}</li>
 *   <li>Illegal field shape (wrong key, uid or block length)</li>
 * </ul>
 *
 * <p>When the envelope was readable enough to carry a {@code request_id}, it is
 * exposed so the session can fail the matching request instead of waiting for
 * its timeout.</p>
 */
public final class ProtocolViolationException extends RuntimeException
{
    private final String requestId;

    public ProtocolViolationException(String message) {
        this(message, null, null);
    }

    public ProtocolViolationException(String message, String requestId, Throwable cause) {
        super(message, cause);
        this.requestId = requestId;
    }

    public Optional<String> requestId() {
        return Optional.ofNullable(requestId);
    }
}

package com.questrail.spooltag.bridge.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * BridgeEvent
 * -----------------------------------------------------------------------------
 * Marker interface for every input processed by the bridge session state
 * machine.
 *
 * <h2>Role in the architecture</h2>
 * Events are the only way information enters the session core:
 * <ul>
 *   <li>Initiator requests</li>
 *   <li>Decoded agent messages (and correlated decode failures)</li>
 *   <li>Request deadlines</li>
 *   <li>Transport lifecycle changes</li>
 * </ul>
 *
 * Events are immutable and processed one at a time. The timestamp is
 * observational only.
 */
public interface BridgeEvent
{
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements BridgeEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}

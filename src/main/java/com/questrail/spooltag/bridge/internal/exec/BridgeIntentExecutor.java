package com.questrail.spooltag.bridge.internal.exec;

import com.questrail.spooltag.bridge.internal.state.BridgeIntents;

/**
 * BridgeIntentExecutor
 * -----------------------------------------------------------------------------
 * Execution boundary for reducer-emitted {@link BridgeIntents}.
 *
 * <p>Executors perform the side effects (send, complete a caller, arm a timer)
 * and never modify session state. Anything they learn is fed back as a new
 * event.</p>
 */
@FunctionalInterface
public interface BridgeIntentExecutor
{
    void execute(BridgeIntents intents);
}

package com.questrail.spooltag.bridge.transport;

/**
 * Callback sink for {@link MessageChannel}.
 *
 * <p>Callbacks for one channel are delivered serially. They are lifecycle and
 * payload signals only and carry no protocol meaning.</p>
 */
public interface MessageChannelListener
{
    /** The channel is open and can send. */
    void onChannelUp();

    /**
     * The channel closed or a connection attempt failed. Delivered at most
     * once per attempt.
     *
     * @param cause diagnostic cause; {@code null} for an orderly close
     */
    void onChannelDown(Throwable cause);

    /** One complete inbound text message. */
    void onMessage(String text);
}

package com.questrail.spooltag.bridge.transport;

/**
 * MessageChannel
 * -----------------------------------------------------------------------------
 * Minimal port for a text-message transport to the tag agent (a WebSocket in
 * production, an in-memory pair in tests).
 *
 * <p>The channel carries whole messages and knows nothing about envelopes.
 * Higher layers are responsible for:</p>
 * <ul>
 *   <li>decoding inbound text into events</li>
 *   <li>using the executor to trigger outbound sends</li>
 * </ul>
 */
public interface MessageChannel
{
    /**
     * Begin connecting. Completion is signalled asynchronously through
     * {@link MessageChannelListener#onChannelUp()} or
     * {@link MessageChannelListener#onChannelDown(Throwable)}.
     *
     * <p>A channel whose connection went down may be started again.</p>
     */
    void start();

    /**
     * Close the channel and release its resources. A stopped channel is not
     * started again.
     */
    void stop();

    /**
     * Send one text message.
     *
     * @return {@code false} if the channel is not open; the message was not sent
     */
    boolean send(String text);

    boolean isOpen();

    /**
     * Must be called before {@link #start()}.
     */
    void setListener(MessageChannelListener listener);
}

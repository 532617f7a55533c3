package com.questrail.spooltag.bridge.model;

/**
 * Initiator to agent request. Every request carries a correlation id that the
 * agent must echo in its response.
 */
public sealed interface BridgeRequest extends BridgeMessage permits ReadTagRequest, WriteTagRequest
{
    String requestId();
}

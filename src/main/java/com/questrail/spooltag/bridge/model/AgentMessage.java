package com.questrail.spooltag.bridge.model;

/**
 * Agent to initiator message.
 */
public sealed interface AgentMessage extends BridgeMessage
        permits AgentStatus, TagDetected, TagData, WriteResult, AgentError
{
}

package com.questrail.triggerware.subscription;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Capability interface for receiving the rows a subscription matches.
 *
 * <p>Invoked once per row, on the connection's handler task.</p>
 */
@FunctionalInterface
public interface SubscriptionListener
{
    void onNotification(JsonNode tuple);
}

package com.questrail.triggerware.api;

/**
 * An illegal subscription state transition, or a subscribe/unsubscribe rejected by the server.
 */
public class SubscriptionException extends TriggerwareClientException
{
    public SubscriptionException(String message) {
        super(message);
    }

    public SubscriptionException(String message, Throwable cause) {
        super(message, cause);
    }
}

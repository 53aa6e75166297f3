package com.questrail.triggerware.api;

/**
 * Base of the domain failure taxonomy.
 *
 * <p>A domain exception always stems from a specific client operation. When it
 * was caused by an error reply, the {@code JsonRpcException} is the cause.
 * Connection loss and internal errors are never wrapped.</p>
 */
public class TriggerwareClientException extends RuntimeException
{
    public TriggerwareClientException(String message) {
        super(message);
    }

    public TriggerwareClientException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.questrail.triggerware.api;

/**
 * A prepared-query parameter was addressed or typed incorrectly.
 */
public class PreparedQueryException extends TriggerwareClientException
{
    public PreparedQueryException(String message) {
        super(message);
    }

    public PreparedQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}

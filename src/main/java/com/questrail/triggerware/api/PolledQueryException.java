package com.questrail.triggerware.api;

/**
 * A polled query's schedule or control parameters are invalid, or the server refused to create it.
 */
public class PolledQueryException extends TriggerwareClientException
{
    public PolledQueryException(String message) {
        super(message);
    }

    public PolledQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}

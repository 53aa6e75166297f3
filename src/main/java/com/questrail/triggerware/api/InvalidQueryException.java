package com.questrail.triggerware.api;

/**
 * The server rejected a query as invalid.
 */
public class InvalidQueryException extends TriggerwareClientException
{
    public InvalidQueryException(String message) {
        super(message);
    }

    public InvalidQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}

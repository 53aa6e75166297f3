package com.questrail.triggerware.protocol.jsonrpc.error;

/**
 * The client-side deadline of a call expired before its reply arrived.
 */
public class CallTimeoutException extends ServerErrorException {

    public CallTimeoutException(String message) {
        super(message);
    }
}

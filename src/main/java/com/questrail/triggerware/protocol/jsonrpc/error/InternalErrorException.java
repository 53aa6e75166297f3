package com.questrail.triggerware.protocol.jsonrpc.error;

/**
 * Internal failure on either side of the connection. Never wrapped into a
 * domain exception.
 */
public class InternalErrorException extends JsonRpcException {

    public InternalErrorException(String message) {
        super(JsonRpcErrorCodes.INTERNAL_ERROR, message);
    }

    public InternalErrorException(String message, Throwable cause) {
        super(JsonRpcErrorCodes.INTERNAL_ERROR, message, cause);
    }
}

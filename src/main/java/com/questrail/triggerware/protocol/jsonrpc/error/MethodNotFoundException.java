package com.questrail.triggerware.protocol.jsonrpc.error;

/**
 * The addressed method is not registered.
 */
public class MethodNotFoundException extends JsonRpcException {

    public MethodNotFoundException(String message) {
        super(JsonRpcErrorCodes.METHOD_NOT_FOUND, message);
    }
}

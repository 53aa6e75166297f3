package com.questrail.triggerware.protocol.jsonrpc.error;

/**
 * The parameters were rejected by the method.
 */
public class InvalidParamsException extends JsonRpcException {

    public InvalidParamsException(String message) {
        super(JsonRpcErrorCodes.INVALID_PARAMS, message);
    }
}

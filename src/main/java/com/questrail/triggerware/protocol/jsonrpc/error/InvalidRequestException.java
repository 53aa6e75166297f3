package com.questrail.triggerware.protocol.jsonrpc.error;

/**
 * A message that is not a valid JSON-RPC 2.0 envelope.
 */
public class InvalidRequestException extends JsonRpcException {

    public InvalidRequestException(String message) {
        super(JsonRpcErrorCodes.INVALID_REQUEST, message);
    }
}

package com.questrail.triggerware.protocol.jsonrpc.error;

/**
 * Malformed JSON received by the peer.
 */
public class ParseErrorException extends JsonRpcException {

    public ParseErrorException(String message) {
        super(JsonRpcErrorCodes.PARSE_ERROR, message);
    }
}

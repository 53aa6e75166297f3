package com.questrail.triggerware.protocol.jsonrpc.error;

/**
 * Generic server/connection error (-32000).
 *
 * <p>Raised locally when the connection is lost or a reply has neither a
 * {@code result} nor an {@code error}. Not operation-specific, so domain
 * operations re-throw it unwrapped.</p>
 */
public class ServerErrorException extends JsonRpcException {

    public ServerErrorException(String message) {
        super(JsonRpcErrorCodes.SERVER_ERROR, message);
    }

    public ServerErrorException(String message, Throwable cause) {
        super(JsonRpcErrorCodes.SERVER_ERROR, message, cause);
    }
}

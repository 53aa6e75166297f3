package com.questrail.triggerware.protocol.jsonrpc.error;

/**
 * Standard JSON-RPC 2.0 error codes, plus the generic server error code used
 * locally for connection loss and malformed replies.
 */
public final class JsonRpcErrorCodes {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int SERVER_ERROR = -32000;

    private JsonRpcErrorCodes() {}
}

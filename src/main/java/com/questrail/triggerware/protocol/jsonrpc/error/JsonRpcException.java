package com.questrail.triggerware.protocol.jsonrpc.error;

import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcError;

/**
 * Base of the transport/protocol failure taxonomy.
 *
 * <p>Every instance carries the JSON-RPC error code it corresponds to. Errors
 * returned by the server are mapped onto the subclass for their code via
 * {@link #fromError(JsonRpcError)}; codes outside the standard set surface as
 * this base type.</p>
 */
public class JsonRpcException extends RuntimeException {

    private final int code;

    public JsonRpcException(int code, String message) {
        super(message);
        this.code = code;
    }

    public JsonRpcException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Converts this exception to the error object placed in a response.
     */
    public JsonRpcError toError() {
        return new JsonRpcError(code, getMessage(), null);
    }

    /**
     * Maps an error object received from the peer onto the matching exception type.
     */
    public static JsonRpcException fromError(JsonRpcError error) {
        String message = error.message();
        switch (error.code()) {
            case JsonRpcErrorCodes.PARSE_ERROR:
                return new ParseErrorException(message);
            case JsonRpcErrorCodes.INVALID_REQUEST:
                return new InvalidRequestException(message);
            case JsonRpcErrorCodes.METHOD_NOT_FOUND:
                return new MethodNotFoundException(message);
            case JsonRpcErrorCodes.INVALID_PARAMS:
                return new InvalidParamsException(message);
            case JsonRpcErrorCodes.INTERNAL_ERROR:
                return new InternalErrorException(message);
            case JsonRpcErrorCodes.SERVER_ERROR:
                return new ServerErrorException(message);
            default:
                return new JsonRpcException(error.code(), message);
        }
    }
}

package com.questrail.triggerware.protocol.jsonrpc.codec;

import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcErrorCodes;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcException;

/**
 * The inbound byte stream contained content that can never become valid JSON,
 * however many further bytes arrive.
 */
public final class JsonFrameException extends JsonRpcException
{
    public JsonFrameException(String message, Throwable cause) {
        super(JsonRpcErrorCodes.PARSE_ERROR, message, cause);
    }
}

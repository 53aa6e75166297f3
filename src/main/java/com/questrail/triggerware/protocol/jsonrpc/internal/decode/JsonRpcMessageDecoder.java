package com.questrail.triggerware.protocol.jsonrpc.internal.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcError;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcMessage;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcNotification;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcRequest;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcResponse;

import java.util.Objects;

/**
 * JsonRpcMessageDecoder
 * ============================================================================
 * Converts a complete JSON value produced by the frame decoder into a semantic
 * {@link JsonRpcMessage}.
 *
 * <h2>Architectural Role</h2>
 * This class is the boundary between stream mechanics (bytes, JSON values) and
 * protocol semantics (requests, notifications, responses). Routing code only
 * ever reasons about {@link JsonRpcMessage}.
 *
 * <h2>Version check</h2>
 * Every envelope must carry {@code "jsonrpc": "2.0"}. A mismatch rejects that
 * one message only; decoding of subsequent messages is unaffected. A rejected
 * reply keeps its id so the call it answers can still be failed.
 */
public final class JsonRpcMessageDecoder
{
    public JsonRpcMessage decode(JsonNode value)
    {
        Objects.requireNonNull(value, "value");

        if (!value.isObject()) {
            throw new JsonRpcDecodeException("JSON-RPC envelope must be an object, got " + value.getNodeType());
        }

        final boolean hasId = value.has("id");
        final boolean hasMethod = value.has("method");
        final JsonNode id = value.get("id");

        JsonNode version = value.get("jsonrpc");
        if (version == null || !version.isTextual() || !JsonRpcMessage.VERSION.equals(version.asText())) {
            String message = "Unsupported JSON-RPC version: " + version;
            if (hasId && !hasMethod) {
                throw JsonRpcDecodeException.forResponse(message, id);
            }
            throw new JsonRpcDecodeException(message, hasId ? id : null);
        }

        if (hasMethod) {
            JsonNode method = value.get("method");
            if (!method.isTextual()) {
                throw new JsonRpcDecodeException("JSON-RPC method must be a string", hasId ? id : null);
            }
            JsonNode params = value.get("params");
            return hasId
                    ? new JsonRpcRequest(id, method.asText(), params)
                    : new JsonRpcNotification(method.asText(), params);
        }

        if (hasId) {
            return new JsonRpcResponse(id, value.get("result"), decodeError(id, value.get("error")));
        }

        throw new JsonRpcDecodeException("JSON-RPC envelope has neither id nor method");
    }

    private static JsonRpcError decodeError(JsonNode id, JsonNode error)
    {
        if (error == null || error.isNull()) {
            return null;
        }
        if (!error.isObject() || !error.path("code").canConvertToInt()) {
            throw JsonRpcDecodeException.forResponse(
                    "JSON-RPC error member must be an object with an integer code", id);
        }
        return new JsonRpcError(
                error.get("code").asInt(),
                error.path("message").asText(""),
                error.get("data"));
    }
}

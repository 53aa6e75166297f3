package com.questrail.triggerware.protocol.jsonrpc.internal.encode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcError;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcMessage;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcNotification;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcRequest;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcResponse;

import java.util.Objects;

/**
 * JsonRpcMessageEncoder
 * ============================================================================
 * Converts a semantic {@link JsonRpcMessage} into its JSON envelope. The frame
 * encoder turns the envelope into bytes.
 *
 * <p>Absent {@code params} are omitted rather than written as {@code null}.</p>
 */
public final class JsonRpcMessageEncoder
{
    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public ObjectNode encode(JsonRpcMessage message)
    {
        Objects.requireNonNull(message, "message");

        ObjectNode envelope = nodes.objectNode();
        envelope.put("jsonrpc", JsonRpcMessage.VERSION);

        if (message instanceof JsonRpcRequest request) {
            envelope.put("method", request.method());
            putParams(envelope, request.params());
            envelope.set("id", request.id());
        }
        else if (message instanceof JsonRpcNotification notification) {
            envelope.put("method", notification.method());
            putParams(envelope, notification.params());
        }
        else if (message instanceof JsonRpcResponse response) {
            envelope.set("id", response.id());
            if (response.hasError()) {
                envelope.set("error", encodeError(response.error()));
            }
            else {
                envelope.set("result", response.hasResult() ? response.result() : nodes.nullNode());
            }
        }
        else {
            throw new IllegalArgumentException("Unsupported message type: " + message.getClass());
        }
        return envelope;
    }

    private static void putParams(ObjectNode envelope, JsonNode params)
    {
        if (params != null && !params.isMissingNode()) {
            envelope.set("params", params);
        }
    }

    private ObjectNode encodeError(JsonRpcError error)
    {
        ObjectNode node = nodes.objectNode();
        node.put("code", error.code());
        node.put("message", error.message());
        if (error.data() != null) {
            node.set("data", error.data());
        }
        return node;
    }
}

package com.questrail.triggerware.protocol.jsonrpc.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Objects;

/**
 * Reply envelope.
 *
 * <p>{@code result} is {@code null} when the field is absent and
 * {@link NullNode} when the peer sent an explicit JSON {@code null}. A reply
 * with neither {@code result} nor {@code error} is an invalid response.</p>
 */
public record JsonRpcResponse(
        JsonNode id,
        JsonNode result,
        JsonRpcError error
) implements JsonRpcMessage
{
    public JsonRpcResponse {
        Objects.requireNonNull(id, "id");
    }

    public static JsonRpcResponse success(JsonNode id, JsonNode result) {
        return new JsonRpcResponse(id, result == null ? NullNode.getInstance() : result, null);
    }

    public static JsonRpcResponse failure(JsonNode id, JsonRpcError error) {
        return new JsonRpcResponse(id, null, Objects.requireNonNull(error, "error"));
    }

    public boolean hasResult() {
        return result != null;
    }

    public boolean hasError() {
        return error != null;
    }
}

package com.questrail.triggerware.protocol.jsonrpc.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A call expecting a reply carrying the same {@code id}.
 *
 * <p>The id is kept as a JSON value so an inbound call is answered with exactly
 * the id the peer sent. Outbound calls always use numeric ids.</p>
 */
public record JsonRpcRequest(
        JsonNode id,
        String method,
        JsonNode params
) implements JsonRpcMessage
{
    public JsonRpcRequest {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(method, "method");
    }
}

package com.questrail.triggerware.protocol.jsonrpc.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * A message without an id. No reply is ever sent for it.
 */
public record JsonRpcNotification(
        String method,
        JsonNode params
) implements JsonRpcMessage
{
    public JsonRpcNotification {
        Objects.requireNonNull(method, "method");
    }
}

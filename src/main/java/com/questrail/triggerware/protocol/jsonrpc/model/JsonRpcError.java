package com.questrail.triggerware.protocol.jsonrpc.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Error object of a failed reply. {@code data} is optional.
 */
public record JsonRpcError(
        int code,
        String message,
        JsonNode data
) {
}

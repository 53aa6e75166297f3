package com.questrail.triggerware.protocol.jsonrpc.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the JSON-RPC client stack.
 */
public record JsonRpcErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}

package com.questrail.triggerware.protocol.jsonrpc.observability;

import java.time.Instant;

/**
 * Record representing a change in connection state.
 */
public record JsonRpcTransportEvent(
    Instant timestamp,
    Kind kind,
    String detail
) {
    public enum Kind {
        CONNECTED,
        DISCONNECTED
    }
}

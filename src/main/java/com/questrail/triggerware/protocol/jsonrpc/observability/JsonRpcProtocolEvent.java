package com.questrail.triggerware.protocol.jsonrpc.observability;

import java.time.Instant;

/**
 * Record representing a tolerated protocol anomaly.
 *
 * @param method the method name involved, or {@code null} if none applies
 */
public record JsonRpcProtocolEvent(
    Instant timestamp,
    Kind kind,
    String method,
    String detail
) {
    public enum Kind {
        /** A reply whose id matches no pending call (late, duplicate, or foreign). */
        UNKNOWN_REPLY_ID,
        /** An inbound call for an unregistered method; answered with -32601. */
        METHOD_NOT_FOUND,
        /** An inbound notification for an unregistered method; dropped. */
        NOTIFICATION_IGNORED,
        /** A polled query notification that reported an error instead of a delta. */
        POLL_ERROR,
        /** A notification whose params had an unexpected shape; dropped. */
        UNEXPECTED_PAYLOAD
    }
}

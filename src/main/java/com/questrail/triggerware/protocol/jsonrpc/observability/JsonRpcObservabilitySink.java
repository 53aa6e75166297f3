package com.questrail.triggerware.protocol.jsonrpc.observability;

/**
 * Main interface for receiving JSON-RPC client observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive on the receive thread, the handler thread, or a
 * caller thread; implementations must be thread-safe and must not block.</p>
 */
public interface JsonRpcObservabilitySink {
    /**
     * Called when the connection changes state (connected, disconnected).
     * @param event the transport event
     */
    void onTransportEvent(JsonRpcTransportEvent event);

    /**
     * Called for a protocol-level anomaly that is tolerated rather than fatal
     * (e.g., a reply for an unknown id, an inbound call for an unknown method,
     * a skipped poll).
     * @param event the protocol event
     */
    void onProtocolEvent(JsonRpcProtocolEvent event);

    /**
     * Called when an error occurs that the client reports but survives
     * (e.g., a malformed message, a failing callback).
     * @param event the error event
     */
    void onError(JsonRpcErrorEvent event);
}

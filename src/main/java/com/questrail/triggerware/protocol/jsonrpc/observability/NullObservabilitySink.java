package com.questrail.triggerware.protocol.jsonrpc.observability;

/**
 * No-op implementation of JsonRpcObservabilitySink.
 */
public final class NullObservabilitySink implements JsonRpcObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onTransportEvent(JsonRpcTransportEvent event) {}

    @Override
    public void onProtocolEvent(JsonRpcProtocolEvent event) {}

    @Override
    public void onError(JsonRpcErrorEvent event) {}
}

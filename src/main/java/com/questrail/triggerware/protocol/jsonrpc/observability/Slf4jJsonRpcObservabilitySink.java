package com.questrail.triggerware.protocol.jsonrpc.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of JsonRpcObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jJsonRpcObservabilitySink implements JsonRpcObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jJsonRpcObservabilitySink.class);

    @Override
    public void onTransportEvent(JsonRpcTransportEvent event) {
        log.info("JSON-RPC Transport {}: {}", event.kind(), event.detail());
    }

    @Override
    public void onProtocolEvent(JsonRpcProtocolEvent event) {
        if (event.kind() == JsonRpcProtocolEvent.Kind.POLL_ERROR) {
            log.warn("Polled query '{}' reported an error: {}", event.method(), event.detail());
            return;
        }
        log.debug("JSON-RPC Protocol Event {} (method={}): {}", event.kind(), event.method(), event.detail());
    }

    @Override
    public void onError(JsonRpcErrorEvent event) {
        log.error("JSON-RPC Error: {}", event.message(), event.cause());
    }
}

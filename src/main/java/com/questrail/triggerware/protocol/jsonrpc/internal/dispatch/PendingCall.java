package com.questrail.triggerware.protocol.jsonrpc.internal.dispatch;

import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcResponse;

import java.util.concurrent.CompletableFuture;

/**
 * An outbound call awaiting its reply. The outcome completes with the reply,
 * or exceptionally when the transport closes.
 */
public record PendingCall(
        long id,
        CompletableFuture<JsonRpcResponse> outcome
) {
}

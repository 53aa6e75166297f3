package com.questrail.triggerware.protocol.jsonrpc.model;

/**
 * Semantic representation of a decoded JSON-RPC 2.0 envelope.
 *
 * <h2>Routing shapes</h2>
 * <p>The shape of an envelope alone decides where it is routed:</p>
 * <ul>
 *   <li>{@code id} and {@code method}: {@link JsonRpcRequest}, an inbound call expecting a reply</li>
 *   <li>{@code id} only: {@link JsonRpcResponse}, a reply to one of our outbound calls</li>
 *   <li>{@code method} only: {@link JsonRpcNotification}, fire-and-forget</li>
 * </ul>
 *
 * <p>An envelope with neither is malformed and never becomes a
 * {@code JsonRpcMessage}.</p>
 */
public sealed interface JsonRpcMessage
        permits JsonRpcRequest, JsonRpcNotification, JsonRpcResponse {

    /** Protocol version carried by every envelope. */
    String VERSION = "2.0";
}

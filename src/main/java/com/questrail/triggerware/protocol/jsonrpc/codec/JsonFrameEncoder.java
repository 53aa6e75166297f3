package com.questrail.triggerware.protocol.jsonrpc.codec;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Serializes one JSON value into the bytes written to the stream, including
 * the whitespace that separates it from the next value.
 */
public interface JsonFrameEncoder
{
    byte[] encode(JsonNode value);
}

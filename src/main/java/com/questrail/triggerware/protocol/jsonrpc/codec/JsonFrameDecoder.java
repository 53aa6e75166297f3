package com.questrail.triggerware.protocol.jsonrpc.codec;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.function.Consumer;

/**
 * JsonFrameDecoder
 * -----------------------------------------------------------------------------
 * Byte-level decoder for a stream of concatenated, whitespace-separated JSON
 * values.
 *
 * <p>Unlike a datagram codec, this decoder is <strong>stateful</strong>: the
 * transport feeds it every chunk read from the socket, in order, and the
 * decoder retains any incomplete trailing value until the bytes that complete
 * it arrive. A single chunk may therefore yield zero, one, or many values.</p>
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Delimiting complete JSON values in the byte stream</li>
 *   <li>Retaining partial input across chunks</li>
 *   <li>Detecting malformed (as opposed to incomplete) input</li>
 * </ul>
 *
 * <p>It does not interpret JSON-RPC envelopes; that is the job of the message
 * decoder one layer up.</p>
 *
 * <h2>Threading</h2>
 * <p>Instances are confined to the single receive task of a transport and are
 * not thread-safe.</p>
 */
public interface JsonFrameDecoder
{
    /**
     * Append a chunk of bytes and emit every JSON value it completes, in stream order.
     *
     * <p>The sink must not throw; a value that cannot be routed is the
     * caller's problem to report.</p>
     *
     * @param chunk bytes exactly as read from the transport
     * @param sink receives each completed value
     * @throws JsonFrameException if the buffered input is malformed; buffered
     *         partial input is discarded and the decoder is ready for new input
     */
    void decode(byte[] chunk, Consumer<JsonNode> sink);

    /**
     * @return {@code true} if bytes of an incomplete value are being retained
     */
    boolean hasPartialFrame();
}

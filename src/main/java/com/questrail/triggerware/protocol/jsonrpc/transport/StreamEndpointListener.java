package com.questrail.triggerware.protocol.jsonrpc.transport;

/**
 * StreamEndpointListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link StreamEndpoint}.
 *
 * <p>All callbacks must be delivered in a <em>serialized</em> manner by the
 * implementation, from a single receive task. Netty endpoints serialize
 * callbacks on the channel's event loop.</p>
 */
public interface StreamEndpointListener
{
    /**
     * Called when the connection becomes usable.
     */
    void onTransportUp();

    /**
     * Called when the connection becomes unusable: peer closed, read error, or
     * local shutdown.
     *
     * @param cause an exception or diagnostic cause; may be {@code null} for
     *              orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called with the bytes of one read, in stream order.
     *
     * <p>Chunk boundaries carry no meaning. A chunk may hold part of a message,
     * exactly one, or several.</p>
     *
     * @param chunk bytes read from the stream; never empty
     */
    void onBytes(byte[] chunk);
}

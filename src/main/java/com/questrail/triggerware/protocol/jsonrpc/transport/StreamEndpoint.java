package com.questrail.triggerware.protocol.jsonrpc.transport;

/**
 * StreamEndpoint
 * -----------------------------------------------------------------------------
 * Minimal port for a persistent, bidirectional byte stream (TCP-style).
 *
 * <p>This endpoint is intentionally small. The JSON-RPC transport above it is
 * responsible for:</p>
 * <ul>
 *   <li>feeding inbound chunks into the frame decoder</li>
 *   <li>routing decoded messages to waiting callers or registered handlers</li>
 *   <li>encoding outbound messages before calling {@link #send(byte[])}</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, plain sockets, or a test harness.</p>
 */
public interface StreamEndpoint
{
    /**
     * Open the connection and begin receiving bytes.
     *
     * <p>Returns once the connection is usable, after notifying
     * {@link StreamEndpointListener#onTransportUp()}. A failure to connect is
     * thrown to the caller.</p>
     */
    void start();

    /**
     * Close the connection and release all transport resources.
     *
     * <p>Idempotent. The listener is notified via
     * {@link StreamEndpointListener#onTransportDown(Throwable)} at most once.</p>
     */
    void stop();

    /**
     * Write bytes to the stream.
     *
     * <p>Safe to call from any thread. The bytes of one call are never
     * interleaved with those of another.</p>
     *
     * @param payload bytes to write
     */
    void send(byte[] payload);

    /**
     * Register the listener that receives inbound bytes and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(StreamEndpointListener listener);
}

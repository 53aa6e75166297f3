package com.questrail.triggerware.protocol.jsonrpc;

/**
 * Where inbound calls and notifications are executed.
 *
 * <p>Both modes preserve wire order. They differ in whether a handler may
 * block on a synchronous {@code call}.</p>
 */
public enum HandlerDispatchMode
{
    /**
     * Handlers run on one dedicated thread, separate from the receive task. A
     * handler may issue a synchronous call: the receive task keeps reading and
     * delivers the reply.
     */
    SERIAL_EXECUTOR,

    /**
     * Handlers run directly on the receive task. A handler that issues a
     * synchronous call can never see its reply, because the only reader is
     * blocked inside that handler. Such a call hangs until the transport closes
     * or the client-side call timeout expires.
     */
    INLINE
}

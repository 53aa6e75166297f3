package com.questrail.triggerware.protocol.jsonrpc.error;

/**
 * The transport closed before a reply arrived, or a call was attempted on a
 * transport that is already closed. Connection loss is terminal.
 */
public class ConnectionClosedException extends ServerErrorException {

    public ConnectionClosedException(String message) {
        super(message);
    }

    public ConnectionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}

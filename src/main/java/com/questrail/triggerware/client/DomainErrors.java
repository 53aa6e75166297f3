package com.questrail.triggerware.client;

import com.questrail.triggerware.api.TriggerwareClientException;
import com.questrail.triggerware.protocol.jsonrpc.error.InternalErrorException;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcException;
import com.questrail.triggerware.protocol.jsonrpc.error.ServerErrorException;

import java.util.function.BiFunction;

/**
 * Translation of protocol failures into the domain taxonomy.
 *
 * <p>Server errors (including connection loss and call timeouts) and internal
 * errors are not operation-specific and pass through unchanged. Every other
 * code is wrapped in the operation's domain exception, keeping the protocol
 * exception as the cause.</p>
 */
public final class DomainErrors
{
    private DomainErrors() {
    }

    public static RuntimeException translate(JsonRpcException e,
                                             BiFunction<String, Throwable, ? extends TriggerwareClientException> wrap) {
        if (e instanceof ServerErrorException || e instanceof InternalErrorException) {
            return e;
        }
        return wrap.apply(e.getMessage(), e);
    }
}

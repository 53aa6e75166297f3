package com.questrail.triggerware.protocol.jsonrpc.internal.dispatch;

import com.questrail.triggerware.protocol.jsonrpc.JsonRpcMethodHandler;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Inbound method name to handler registry.
 *
 * <p>Mutated at runtime as polled queries and subscriptions come and go; read
 * by the handler task for every inbound call and notification. Synchronized
 * independently of the {@link CorrelationTable}.</p>
 */
public final class DispatchTable
{
    private final ConcurrentMap<String, JsonRpcMethodHandler> handlers = new ConcurrentHashMap<>();

    /**
     * Register {@code handler} under {@code method}, replacing any previous registration.
     */
    public void add(String method, JsonRpcMethodHandler handler)
    {
        handlers.put(Objects.requireNonNull(method, "method"), Objects.requireNonNull(handler, "handler"));
    }

    /**
     * @return {@code true} if a handler was registered under {@code method}
     */
    public boolean remove(String method)
    {
        return handlers.remove(Objects.requireNonNull(method, "method")) != null;
    }

    public Optional<JsonRpcMethodHandler> lookup(String method)
    {
        return Optional.ofNullable(handlers.get(method));
    }

    public boolean contains(String method)
    {
        return handlers.containsKey(method);
    }
}

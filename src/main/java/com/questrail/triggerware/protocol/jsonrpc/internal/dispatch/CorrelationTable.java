package com.questrail.triggerware.protocol.jsonrpc.internal.dispatch;

import com.questrail.triggerware.protocol.jsonrpc.error.ConnectionClosedException;
import com.questrail.triggerware.protocol.jsonrpc.error.ServerErrorException;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcResponse;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * CorrelationTable
 * =============================================================================
 * Maps the numeric id of each outbound call to the caller waiting for it.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>Ids start at 0 and strictly increase for the life of the table</li>
 *   <li>An id is matched or failed at most once; either removes the entry</li>
 *   <li>After {@link #closeAll(ConnectionClosedException)} every current and
 *       future registration fails with the close cause</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Any number of caller threads may register and await concurrently while the
 * receive task completes entries. Each caller is woken only by its own reply.
 * This table shares no lock with the dispatch table.
 */
public final class CorrelationTable
{
    private final AtomicLong nextId = new AtomicLong();
    private final ConcurrentMap<Long, CompletableFuture<JsonRpcResponse>> pending = new ConcurrentHashMap<>();

    private volatile ConnectionClosedException closedCause;

    /**
     * Allocate the next id and register a waiter for it.
     *
     * <p>Registration happens before the request is written, so a reply can
     * never overtake its own entry.</p>
     *
     * @throws ConnectionClosedException if the table is already closed
     */
    public PendingCall register()
    {
        ConnectionClosedException closed = closedCause;
        if (closed != null) {
            throw new ConnectionClosedException(closed.getMessage(), closed);
        }

        long id = nextId.getAndIncrement();
        CompletableFuture<JsonRpcResponse> outcome = new CompletableFuture<>();
        pending.put(id, outcome);

        // closeAll() may have drained the map between the check above and the put.
        closed = closedCause;
        if (closed != null && pending.remove(id, outcome)) {
            throw new ConnectionClosedException(closed.getMessage(), closed);
        }
        return new PendingCall(id, outcome);
    }

    /**
     * Deliver a reply to the waiter registered under {@code id}.
     *
     * @return {@code false} if no call is pending under that id
     */
    public boolean complete(long id, JsonRpcResponse response)
    {
        Objects.requireNonNull(response, "response");
        CompletableFuture<JsonRpcResponse> outcome = pending.remove(id);
        if (outcome == null) {
            return false;
        }
        outcome.complete(response);
        return true;
    }

    /**
     * Fail the waiter registered under {@code id}, for a reply that arrived
     * but could not be decoded.
     *
     * @return {@code false} if no call is pending under that id
     */
    public boolean fail(long id, ServerErrorException cause)
    {
        Objects.requireNonNull(cause, "cause");
        CompletableFuture<JsonRpcResponse> outcome = pending.remove(id);
        if (outcome == null) {
            return false;
        }
        outcome.completeExceptionally(cause);
        return true;
    }

    /**
     * Drop the entry of a caller that stopped waiting (timeout, interrupt, send failure).
     */
    public void abandon(long id)
    {
        pending.remove(id);
    }

    /**
     * Mark the table closed and fail every pending waiter with {@code cause}.
     */
    public void closeAll(ConnectionClosedException cause)
    {
        Objects.requireNonNull(cause, "cause");
        closedCause = cause;
        for (Long id : pending.keySet()) {
            CompletableFuture<JsonRpcResponse> outcome = pending.remove(id);
            if (outcome != null) {
                outcome.completeExceptionally(cause);
            }
        }
    }

    public boolean isClosed()
    {
        return closedCause != null;
    }

    public int pendingCount()
    {
        return pending.size();
    }
}

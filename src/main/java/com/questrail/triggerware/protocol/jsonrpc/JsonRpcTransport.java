package com.questrail.triggerware.protocol.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.LongNode;
import com.questrail.triggerware.protocol.jsonrpc.codec.JsonFrameDecoder;
import com.questrail.triggerware.protocol.jsonrpc.codec.JsonFrameEncoder;
import com.questrail.triggerware.protocol.jsonrpc.codec.JsonFrameException;
import com.questrail.triggerware.protocol.jsonrpc.codec.impl.DefaultJsonFrameDecoder;
import com.questrail.triggerware.protocol.jsonrpc.codec.impl.DefaultJsonFrameEncoder;
import com.questrail.triggerware.protocol.jsonrpc.error.CallTimeoutException;
import com.questrail.triggerware.protocol.jsonrpc.error.ConnectionClosedException;
import com.questrail.triggerware.protocol.jsonrpc.error.InternalErrorException;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcException;
import com.questrail.triggerware.protocol.jsonrpc.error.MethodNotFoundException;
import com.questrail.triggerware.protocol.jsonrpc.error.ServerErrorException;
import com.questrail.triggerware.protocol.jsonrpc.internal.decode.JsonRpcDecodeException;
import com.questrail.triggerware.protocol.jsonrpc.internal.decode.JsonRpcMessageDecoder;
import com.questrail.triggerware.protocol.jsonrpc.internal.dispatch.CorrelationTable;
import com.questrail.triggerware.protocol.jsonrpc.internal.dispatch.DispatchTable;
import com.questrail.triggerware.protocol.jsonrpc.internal.dispatch.PendingCall;
import com.questrail.triggerware.protocol.jsonrpc.internal.encode.JsonRpcMessageEncoder;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcMessage;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcNotification;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcRequest;
import com.questrail.triggerware.protocol.jsonrpc.model.JsonRpcResponse;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcErrorEvent;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcObservabilitySink;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcProtocolEvent;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcTransportEvent;
import com.questrail.triggerware.protocol.jsonrpc.transport.StreamEndpoint;
import com.questrail.triggerware.protocol.jsonrpc.transport.StreamEndpointListener;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * JsonRpcTransport
 * =============================================================================
 * Bidirectional JSON-RPC 2.0 engine over one persistent {@link StreamEndpoint}.
 *
 * <h2>Inbound path (decode-before-route)</h2>
 *
 * <pre>
 *   StreamEndpoint (single receive task)
 *        → JsonFrameDecoder
 *            → JsonRpcMessageDecoder
 *                → JsonRpcResponse     → CorrelationTable (wakes one caller)
 *                → JsonRpcRequest      → DispatchTable.execute → reply
 *                → JsonRpcNotification → DispatchTable.notify
 * </pre>
 *
 * <h2>Outbound path</h2>
 *
 * <pre>
 *   call / notify / reply
 *        → JsonRpcMessageEncoder
 *            → JsonFrameEncoder
 *                → StreamEndpoint.send(...)
 * </pre>
 *
 * <h2>Execution model</h2>
 * <p>Any number of threads may block in {@link #call} at once, each on its own
 * id; replies may arrive in any order. Inbound calls and notifications are
 * handled strictly in wire order, either on a dedicated handler thread or on
 * the receive task itself, per {@link HandlerDispatchMode}.</p>
 *
 * <h2>Failure semantics</h2>
 * <p>A malformed or unroutable message is reported to the observability sink
 * and skipped. Connection loss closes the transport permanently and fails
 * every pending call with {@link ConnectionClosedException}. There is no
 * reconnection.</p>
 */
public final class JsonRpcTransport implements StreamEndpointListener
{
    private final StreamEndpoint endpoint;

    private final JsonFrameDecoder frameDecoder;
    private final JsonFrameEncoder frameEncoder;

    private final JsonRpcMessageDecoder messageDecoder;
    private final JsonRpcMessageEncoder messageEncoder;

    private final CorrelationTable correlation = new CorrelationTable();
    private final DispatchTable dispatch = new DispatchTable();

    private final ExecutorService handlerExecutor; // null when INLINE
    private final Duration callTimeout;            // null means unbounded
    private final JsonRpcObservabilitySink sink;

    private final AtomicBoolean closed = new AtomicBoolean();

    public JsonRpcTransport(StreamEndpoint endpoint,
                            ObjectMapper mapper,
                            HandlerDispatchMode dispatchMode,
                            Duration callTimeout,
                            JsonRpcObservabilitySink sink) {
        this(endpoint,
                new DefaultJsonFrameDecoder(mapper),
                new DefaultJsonFrameEncoder(mapper),
                new JsonRpcMessageDecoder(),
                new JsonRpcMessageEncoder(),
                dispatchMode,
                callTimeout,
                sink);
    }

    public JsonRpcTransport(StreamEndpoint endpoint,
                            JsonFrameDecoder frameDecoder,
                            JsonFrameEncoder frameEncoder,
                            JsonRpcMessageDecoder messageDecoder,
                            JsonRpcMessageEncoder messageEncoder,
                            HandlerDispatchMode dispatchMode,
                            Duration callTimeout,
                            JsonRpcObservabilitySink sink) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.frameDecoder = Objects.requireNonNull(frameDecoder, "frameDecoder");
        this.frameEncoder = Objects.requireNonNull(frameEncoder, "frameEncoder");
        this.messageDecoder = Objects.requireNonNull(messageDecoder, "messageDecoder");
        this.messageEncoder = Objects.requireNonNull(messageEncoder, "messageEncoder");
        Objects.requireNonNull(dispatchMode, "dispatchMode");
        this.callTimeout = callTimeout;
        this.sink = Objects.requireNonNull(sink, "sink");

        this.handlerExecutor = dispatchMode == HandlerDispatchMode.SERIAL_EXECUTOR
                ? Executors.newSingleThreadExecutor(r -> {
                    Thread t = new Thread(r, "jsonrpc-handler");
                    t.setDaemon(true);
                    return t;
                })
                : null;

        // The endpoint is the raw I/O surface; this transport is the translation layer.
        this.endpoint.setListener(this);
    }

    /**
     * Open the connection.
     *
     * @throws ServerErrorException if the endpoint cannot connect
     */
    public void start() {
        try {
            endpoint.start();
        } catch (RuntimeException e) {
            close();
            throw new ServerErrorException("Unable to open connection: " + e.getMessage(), e);
        }
    }

    /**
     * Close the transport permanently. Every pending call fails with
     * {@link ConnectionClosedException}. Idempotent.
     */
    public void close() {
        shutdown(null);
    }

    public boolean isClosed() {
        return closed.get();
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Call {@code method} and block until its reply arrives, using the
     * configured client-side deadline (if any).
     *
     * @return the {@code result} of the reply; {@code NullNode} for an explicit JSON null
     * @throws JsonRpcException the server's error, mapped by code
     * @throws ServerErrorException if the reply has neither result nor error
     * @throws ConnectionClosedException if the transport closes first
     * @throws CallTimeoutException if the client-side deadline expires first
     */
    public JsonNode call(String method, JsonNode params) {
        return call(method, params, callTimeout);
    }

    /**
     * As {@link #call(String, JsonNode)}, with an explicit client-side deadline.
     *
     * @param timeout deadline for the reply; {@code null} waits until reply or close
     */
    public JsonNode call(String method, JsonNode params, Duration timeout) {
        Objects.requireNonNull(method, "method");

        PendingCall pending = correlation.register();
        try {
            send(new JsonRpcRequest(LongNode.valueOf(pending.id()), method, params));
        } catch (RuntimeException e) {
            correlation.abandon(pending.id());
            throw e;
        }

        JsonRpcResponse response = await(pending, method, timeout);

        if (response.hasError()) {
            throw JsonRpcException.fromError(response.error());
        }
        if (!response.hasResult()) {
            throw new ServerErrorException("Server sent an invalid response to '" + method + "'");
        }
        return response.result();
    }

    /**
     * Send a notification. Never waits for anything but the local write.
     *
     * @throws ConnectionClosedException if the transport is closed
     */
    public void notify(String method, JsonNode params) {
        Objects.requireNonNull(method, "method");
        if (closed.get()) {
            throw new ConnectionClosedException("Connection closed");
        }
        send(new JsonRpcNotification(method, params));
    }

    /**
     * Register the callbacks for inbound calls and notifications on {@code method}.
     */
    public void addMethod(String method, JsonRpcMethodHandler handler) {
        dispatch.add(method, handler);
    }

    /**
     * @return {@code true} if a handler was registered under {@code method}
     */
    public boolean removeMethod(String method) {
        return dispatch.remove(method);
    }

    public boolean hasMethod(String method) {
        return dispatch.contains(method);
    }

    public int pendingCallCount() {
        return correlation.pendingCount();
    }

    private JsonRpcResponse await(PendingCall pending, String method, Duration timeout) {
        try {
            return timeout == null
                    ? pending.outcome().get()
                    : pending.outcome().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ConnectionClosedException) {
                throw new ConnectionClosedException(
                        "Connection closed before response to '" + method + "' received", cause);
            }
            if (cause instanceof ServerErrorException) {
                throw new ServerErrorException(
                        "Server sent an invalid response to '" + method + "': " + cause.getMessage(), cause);
            }
            throw new InternalErrorException("Call to '" + method + "' failed", cause);
        } catch (TimeoutException e) {
            correlation.abandon(pending.id());
            throw new CallTimeoutException("No response to '" + method + "' (id " + pending.id()
                    + ") within " + timeout);
        } catch (InterruptedException e) {
            correlation.abandon(pending.id());
            Thread.currentThread().interrupt();
            throw new InternalErrorException("Interrupted while waiting for response to '" + method + "'", e);
        }
    }

    private void send(JsonRpcMessage message) {
        byte[] payload = frameEncoder.encode(messageEncoder.encode(message));
        try {
            endpoint.send(payload);
        } catch (IllegalStateException e) {
            throw new ConnectionClosedException("Connection is not open", e);
        }
    }

    /**
     * Send from the receive or handler task, where there is no caller to throw to.
     */
    private void reply(JsonRpcResponse response) {
        if (closed.get()) {
            return;
        }
        try {
            send(response);
        } catch (RuntimeException e) {
            sink.onError(new JsonRpcErrorEvent(Instant.now(), "Failed to send reply for id " + response.id(), e));
        }
    }

    // -------------------------------------------------------------------------
    // StreamEndpointListener (receive task)
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        sink.onTransportEvent(new JsonRpcTransportEvent(Instant.now(), JsonRpcTransportEvent.Kind.CONNECTED, null));
    }

    @Override
    public void onTransportDown(Throwable cause) {
        shutdown(cause);
    }

    @Override
    public void onBytes(byte[] chunk) {
        try {
            frameDecoder.decode(chunk, this::route);
        } catch (JsonFrameException e) {
            sink.onError(new JsonRpcErrorEvent(Instant.now(), "Discarded malformed inbound bytes", e));
        }
    }

    private void route(JsonNode value) {
        final JsonRpcMessage message;
        try {
            message = messageDecoder.decode(value);
        } catch (JsonRpcDecodeException e) {
            sink.onError(new JsonRpcErrorEvent(Instant.now(), "Rejected inbound message: " + e.getMessage(), e));
            e.replyId().ifPresent(id -> reply(JsonRpcResponse.failure(id, e.toError())));
            e.responseId().ifPresent(id -> failPending(id, e));
            return;
        }

        if (message instanceof JsonRpcResponse response) {
            onResponse(response);
        }
        else if (message instanceof JsonRpcRequest request) {
            dispatchInbound(() -> onRequest(request));
        }
        else if (message instanceof JsonRpcNotification notification) {
            dispatchInbound(() -> onNotification(notification));
        }
    }

    private void onResponse(JsonRpcResponse response) {
        JsonNode id = response.id();
        if (id.isIntegralNumber() && id.canConvertToLong() && correlation.complete(id.asLong(), response)) {
            return;
        }
        sink.onProtocolEvent(new JsonRpcProtocolEvent(Instant.now(),
                JsonRpcProtocolEvent.Kind.UNKNOWN_REPLY_ID, null, "No pending call for id " + id));
    }

    private void failPending(JsonNode id, JsonRpcDecodeException rejected) {
        if (id.isIntegralNumber() && id.canConvertToLong()
                && correlation.fail(id.asLong(), new ServerErrorException(rejected.getMessage(), rejected))) {
            return;
        }
        sink.onProtocolEvent(new JsonRpcProtocolEvent(Instant.now(),
                JsonRpcProtocolEvent.Kind.UNKNOWN_REPLY_ID, null, "No pending call for id " + id));
    }

    private void dispatchInbound(Runnable task) {
        if (handlerExecutor == null) {
            task.run();
            return;
        }
        try {
            handlerExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            sink.onError(new JsonRpcErrorEvent(Instant.now(), "Inbound message arrived after close; dropped", e));
        }
    }

    private void onRequest(JsonRpcRequest request) {
        JsonRpcMethodHandler handler = dispatch.lookup(request.method()).orElse(null);
        if (handler == null) {
            sink.onProtocolEvent(new JsonRpcProtocolEvent(Instant.now(),
                    JsonRpcProtocolEvent.Kind.METHOD_NOT_FOUND, request.method(), "Inbound call id " + request.id()));
            MethodNotFoundException notFound =
                    new MethodNotFoundException("Method '" + request.method() + "' not found");
            reply(JsonRpcResponse.failure(request.id(), notFound.toError()));
            return;
        }

        JsonRpcResponse response;
        try {
            response = JsonRpcResponse.success(request.id(), handler.execute(request.params()));
        } catch (JsonRpcException e) {
            response = JsonRpcResponse.failure(request.id(), e.toError());
        } catch (RuntimeException e) {
            sink.onError(new JsonRpcErrorEvent(Instant.now(),
                    "Handler for '" + request.method() + "' failed", e));
            response = JsonRpcResponse.failure(request.id(),
                    new InternalErrorException("Handler for '" + request.method() + "' failed").toError());
        }
        reply(response);
    }

    private void onNotification(JsonRpcNotification notification) {
        JsonRpcMethodHandler handler = dispatch.lookup(notification.method()).orElse(null);
        if (handler == null) {
            sink.onProtocolEvent(new JsonRpcProtocolEvent(Instant.now(),
                    JsonRpcProtocolEvent.Kind.NOTIFICATION_IGNORED, notification.method(), null));
            return;
        }
        try {
            handler.handleNotification(notification.params());
        } catch (RuntimeException e) {
            sink.onError(new JsonRpcErrorEvent(Instant.now(),
                    "Notification handler for '" + notification.method() + "' failed", e));
        }
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    private void shutdown(Throwable cause) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        ConnectionClosedException closedException = cause == null
                ? new ConnectionClosedException("Connection closed")
                : new ConnectionClosedException("Connection lost: " + cause.getMessage(), cause);
        correlation.closeAll(closedException);

        endpoint.stop();
        if (handlerExecutor != null) {
            // Handlers already queued still run; they observe a closed transport.
            handlerExecutor.shutdown();
        }

        sink.onTransportEvent(new JsonRpcTransportEvent(Instant.now(),
                JsonRpcTransportEvent.Kind.DISCONNECTED, cause == null ? "closed" : cause.toString()));
    }
}

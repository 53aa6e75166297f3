package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.triggerware.api.PolledQueryException;
import com.questrail.triggerware.api.Query;
import com.questrail.triggerware.api.QueryRestriction;
import com.questrail.triggerware.client.DomainErrors;
import com.questrail.triggerware.client.MethodNameAllocator;
import com.questrail.triggerware.client.TriggerwareClient;
import com.questrail.triggerware.protocol.jsonrpc.JsonRpcMethodHandler;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcException;
import com.questrail.triggerware.protocol.jsonrpc.error.ServerErrorException;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcProtocolEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * PolledQuery
 * =============================================================================
 * A query the server re-evaluates on a schedule, reporting the difference
 * from its previous answer to this client.
 *
 * <h2>Lifecycle</h2>
 * <ol>
 *   <li>A connection-unique method name ({@code pollN}) is allocated and a
 *       handler is registered under it.</li>
 *   <li>{@code create-polled-query} submits the query, its schedule and its
 *       control parameters. On failure the handler is removed again.</li>
 *   <li>The server notifies the method name with a {@code delta} after each
 *       poll, or with an {@code error} when a poll fails or is skipped.</li>
 *   <li>{@link #close()} stops local delivery.</li>
 * </ol>
 *
 * <h2>Overlapping polls</h2>
 * <p>If a poll becomes due while the previous one is still running, the
 * server skips it and sends an error notification. That is delivered to
 * {@link PolledQueryListener#onPollError} and is not a protocol violation.</p>
 */
public final class PolledQuery implements AutoCloseable
{
    private final TriggerwareClient client;
    private final Query query;
    private final QueryRestriction restriction;
    private final PolledQueryListener listener;
    private final String methodName;

    private final long handle;
    private final JsonNode signature;

    private PolledQuery(Builder b) {
        this.client = b.client;
        this.query = b.query;
        this.restriction = b.restriction;
        this.listener = b.listener;

        ObjectNode params = QueryParameters.base(query, restriction);
        if (b.schedule != null) {
            b.schedule.validate();
            params.set("schedule", b.schedule.toJson());
        }
        if (b.controls != null) {
            b.controls.writeTo(params);
        }

        this.methodName = client.allocateMethodName(MethodNameAllocator.POLLED_QUERY);
        params.put("method", methodName);

        // Registered first: with report-initial the first delta may precede the reply.
        client.transport().addMethod(methodName, JsonRpcMethodHandler.forNotifications(this::onNotification));

        JsonNode registration;
        try {
            registration = client.transport().call("create-polled-query", params);
        } catch (JsonRpcException e) {
            client.transport().removeMethod(methodName);
            throw DomainErrors.translate(e, PolledQueryException::new);
        }

        JsonNode h = registration.path("handle");
        if (!h.isIntegralNumber()) {
            client.transport().removeMethod(methodName);
            throw new ServerErrorException("Server sent an invalid response to 'create-polled-query'");
        }
        this.handle = h.asLong();
        this.signature = registration.path("signature").isMissingNode()
                ? JsonNodeFactory.instance.arrayNode()
                : registration.get("signature");

        client.registerHandle(handle);
    }

    public static Builder builder(TriggerwareClient client, Query query, PolledQueryListener listener) {
        return new Builder(client, query, listener);
    }

    public long handle() {
        return handle;
    }

    public JsonNode signature() {
        return signature;
    }

    public String methodName() {
        return methodName;
    }

    public Query query() {
        return query;
    }

    /**
     * Ask the server to poll now, outside the schedule. The resulting delta
     * (or error) arrives as a notification.
     */
    public void pollNow() {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("handle", handle);
        if (restriction.timeout() != null) {
            params.put("timelimit", restriction.timeout());
        }
        try {
            client.transport().call("poll-now", params);
        } catch (JsonRpcException e) {
            throw DomainErrors.translate(e, PolledQueryException::new);
        }
    }

    /**
     * Stop delivering notifications. The server is not told; later
     * notifications for this query are ignored.
     */
    @Override
    public void close() {
        client.transport().removeMethod(methodName);
    }

    private void onNotification(JsonNode params) {
        JsonNode delta = params.path("delta");
        if (delta.isObject()) {
            listener.onDelta(new RowsDelta(rows(delta.path("added")), rows(delta.path("deleted"))));
            return;
        }

        JsonNode error = params.path("error");
        if (!error.isMissingNode()) {
            PollError pollError = new PollError(methodName, error);
            client.observabilitySink().onProtocolEvent(new JsonRpcProtocolEvent(Instant.now(),
                    JsonRpcProtocolEvent.Kind.POLL_ERROR, methodName, pollError.message()));
            listener.onPollError(pollError);
            return;
        }

        client.observabilitySink().onProtocolEvent(new JsonRpcProtocolEvent(Instant.now(),
                JsonRpcProtocolEvent.Kind.UNEXPECTED_PAYLOAD, methodName, String.valueOf(params)));
    }

    private static List<JsonNode> rows(JsonNode tuples) {
        List<JsonNode> rows = new ArrayList<>();
        tuples.forEach(rows::add);
        return rows;
    }

    public static final class Builder {
        private final TriggerwareClient client;
        private final Query query;
        private final PolledQueryListener listener;
        private QueryRestriction restriction = QueryRestriction.NONE;
        private PolledQueryControlParameters controls;
        private PolledQuerySchedule schedule;

        private Builder(TriggerwareClient client, Query query, PolledQueryListener listener) {
            this.client = Objects.requireNonNull(client, "client");
            this.query = Objects.requireNonNull(query, "query");
            this.listener = Objects.requireNonNull(listener, "listener");
        }

        public Builder withRestriction(QueryRestriction restriction) {
            this.restriction = Objects.requireNonNull(restriction, "restriction");
            return this;
        }

        public Builder withControls(PolledQueryControlParameters controls) {
            this.controls = controls;
            return this;
        }

        public Builder withSchedule(PolledQuerySchedule schedule) {
            this.schedule = schedule;
            return this;
        }

        /**
         * Create the polled query on the server.
         *
         * @throws PolledQueryException if the schedule is malformed or the server refuses the query
         */
        public PolledQuery create() {
            return new PolledQuery(this);
        }
    }
}

package com.questrail.triggerware.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.triggerware.api.Query;
import com.questrail.triggerware.api.QueryRestriction;
import com.questrail.triggerware.api.SubscriptionException;
import com.questrail.triggerware.client.DomainErrors;
import com.questrail.triggerware.client.MethodNameAllocator;
import com.questrail.triggerware.client.TriggerwareClient;
import com.questrail.triggerware.protocol.jsonrpc.JsonRpcMethodHandler;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcException;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcProtocolEvent;
import com.questrail.triggerware.query.QueryParameters;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Subscription
 * =============================================================================
 * Interest in a future change to the server's data, described by a query.
 * Each time a change matches, the server notifies the client with the
 * matching row.
 *
 * <h2>State machine</h2>
 * <p>A subscription starts {@link SubscriptionState#INACTIVE}. It receives
 * notifications either on its own (after {@link #activate()}, addressed to
 * its label) or as a member of one {@link BatchSubscription} (after
 * {@link #addToBatch}, addressed to the batch). The two are mutually
 * exclusive, and both return to inactive through their mirror operation.</p>
 *
 * <p>A transition the current state does not allow, or one the server
 * refuses, throws {@link SubscriptionException} and leaves the state
 * unchanged.</p>
 */
public final class Subscription
{
    private final TriggerwareClient client;
    private final Query query;
    private final SubscriptionListener listener;
    private final String label;
    private final ObjectNode baseParameters;
    private final JsonRpcMethodHandler handler;

    private volatile SubscriptionState state = SubscriptionState.INACTIVE;
    private volatile BatchSubscription batch;

    public Subscription(TriggerwareClient client, Query query, SubscriptionListener listener) {
        this.client = Objects.requireNonNull(client, "client");
        this.query = Objects.requireNonNull(query, "query");
        this.listener = Objects.requireNonNull(listener, "listener");

        this.label = client.allocateMethodName(MethodNameAllocator.SUBSCRIPTION);
        this.baseParameters = QueryParameters.base(query, QueryRestriction.NONE);
        this.baseParameters.put("label", label);
        this.handler = JsonRpcMethodHandler.forNotifications(this::onNotification);
    }

    public String label() {
        return label;
    }

    public Query query() {
        return query;
    }

    public TriggerwareClient client() {
        return client;
    }

    public SubscriptionState state() {
        return state;
    }

    public boolean isActive() {
        return state == SubscriptionState.ACTIVE;
    }

    public boolean isBatchMember() {
        return state == SubscriptionState.BATCH_MEMBER;
    }

    public Optional<BatchSubscription> batch() {
        return Optional.ofNullable(batch);
    }

    /**
     * Start receiving notifications addressed to this subscription's label.
     */
    public synchronized void activate() {
        if (state == SubscriptionState.BATCH_MEMBER) {
            throw new SubscriptionException("Cannot activate subscription that is part of a batch.");
        }
        if (state == SubscriptionState.ACTIVE) {
            throw new SubscriptionException("Subscription is already active.");
        }

        // Registered before subscribing so a notification racing the reply is delivered.
        client.transport().addMethod(label, handler);
        try {
            client.transport().call("subscribe", subscribeParams(label, false));
        } catch (JsonRpcException e) {
            client.transport().removeMethod(label);
            throw DomainErrors.translate(e, SubscriptionException::new);
        }
        state = SubscriptionState.ACTIVE;
    }

    public synchronized void deactivate() {
        if (state == SubscriptionState.BATCH_MEMBER) {
            throw new SubscriptionException("Cannot deactivate a subscription that is part of a batch.");
        }
        if (state == SubscriptionState.INACTIVE) {
            throw new SubscriptionException("Subscription is already inactive.");
        }

        try {
            client.transport().call("unsubscribe", subscribeParams(label, false));
        } catch (JsonRpcException e) {
            throw DomainErrors.translate(e, SubscriptionException::new);
        }
        client.transport().removeMethod(label);
        state = SubscriptionState.INACTIVE;
    }

    /**
     * Receive notifications through {@code target}'s combined method instead
     * of individually.
     */
    public synchronized void addToBatch(BatchSubscription target) {
        Objects.requireNonNull(target, "target");
        if (state == SubscriptionState.ACTIVE) {
            throw new SubscriptionException("Cannot add active subscription to a batch.");
        }
        if (state == SubscriptionState.BATCH_MEMBER) {
            throw new SubscriptionException("Subscription is already part of another batch.");
        }
        if (target.client() != client) {
            throw new SubscriptionException("Subscription and batch registered with different clients.");
        }

        target.attach(this);
        try {
            client.transport().call("subscribe", subscribeParams(target.methodName(), true));
        } catch (JsonRpcException e) {
            target.detach(this);
            throw DomainErrors.translate(e, SubscriptionException::new);
        }
        batch = target;
        state = SubscriptionState.BATCH_MEMBER;
    }

    public synchronized void removeFromBatch() {
        BatchSubscription current = batch;
        if (state != SubscriptionState.BATCH_MEMBER || current == null) {
            throw new SubscriptionException("Subscription is not part of a batch.");
        }

        try {
            client.transport().call("unsubscribe", subscribeParams(current.methodName(), true));
        } catch (JsonRpcException e) {
            throw DomainErrors.translate(e, SubscriptionException::new);
        }
        current.detach(this);
        batch = null;
        state = SubscriptionState.INACTIVE;
    }

    /**
     * Rows for this subscription that arrived in a batch notification.
     */
    void deliverFromBatch(JsonNode tuples) {
        for (JsonNode tuple : tuples) {
            listener.onNotification(tuple);
        }
    }

    private void onNotification(JsonNode params) {
        JsonNode tuple = params.path("tuple");
        if (tuple.isMissingNode()) {
            client.observabilitySink().onProtocolEvent(new JsonRpcProtocolEvent(Instant.now(),
                    JsonRpcProtocolEvent.Kind.UNEXPECTED_PAYLOAD, label, String.valueOf(params)));
            return;
        }
        listener.onNotification(tuple);
    }

    private ObjectNode subscribeParams(String method, boolean combine) {
        ObjectNode params = baseParameters.deepCopy();
        params.put("method", method);
        params.put("combine", combine);
        return params;
    }
}

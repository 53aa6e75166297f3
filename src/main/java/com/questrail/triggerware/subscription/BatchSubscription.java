package com.questrail.triggerware.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.triggerware.api.SubscriptionException;
import com.questrail.triggerware.client.MethodNameAllocator;
import com.questrail.triggerware.client.TriggerwareClient;
import com.questrail.triggerware.protocol.jsonrpc.JsonRpcMethodHandler;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcErrorEvent;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcProtocolEvent;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * BatchSubscription
 * -----------------------------------------------------------------------------
 * Groups subscriptions whose matches the server reports together, so one
 * change to the data yields a single notification for every member it
 * affects.
 *
 * <p>The batch registers one method name ({@code batchN}). Each notification
 * carries a {@code matches} list of {@code {label, tuples}}; the rows of a
 * match are delivered one by one to the member with that label. Matches for
 * labels that are no longer members are dropped. A member whose listener
 * throws is reported to the observability sink; the remaining matches are
 * still delivered.</p>
 */
public final class BatchSubscription
{
    private final TriggerwareClient client;
    private final String methodName;
    private final Map<String, Subscription> members = new ConcurrentHashMap<>();

    public BatchSubscription(TriggerwareClient client) {
        this.client = Objects.requireNonNull(client, "client");
        this.methodName = client.allocateMethodName(MethodNameAllocator.BATCH);
        client.transport().addMethod(methodName, JsonRpcMethodHandler.forNotifications(this::onNotification));
    }

    public TriggerwareClient client() {
        return client;
    }

    public String methodName() {
        return methodName;
    }

    public Collection<Subscription> members() {
        return Collections.unmodifiableCollection(members.values());
    }

    public boolean contains(Subscription subscription) {
        return members.get(subscription.label()) == subscription;
    }

    /**
     * Same as {@code subscription.addToBatch(this)}.
     */
    public void addSubscription(Subscription subscription) {
        subscription.addToBatch(this);
    }

    /**
     * Same as {@code subscription.removeFromBatch()}, after checking that the
     * subscription belongs to this batch.
     */
    public void removeSubscription(Subscription subscription) {
        if (!contains(subscription)) {
            throw new SubscriptionException("Subscription is not part of this batch.");
        }
        subscription.removeFromBatch();
    }

    void attach(Subscription subscription) {
        members.put(subscription.label(), subscription);
    }

    void detach(Subscription subscription) {
        members.remove(subscription.label(), subscription);
    }

    private void onNotification(JsonNode params) {
        JsonNode matches = params.path("matches");
        if (!matches.isArray()) {
            client.observabilitySink().onProtocolEvent(new JsonRpcProtocolEvent(Instant.now(),
                    JsonRpcProtocolEvent.Kind.UNEXPECTED_PAYLOAD, methodName, String.valueOf(params)));
            return;
        }
        for (JsonNode match : matches) {
            Subscription member = members.get(match.path("label").asText());
            if (member == null) {
                continue;
            }
            try {
                member.deliverFromBatch(match.path("tuples"));
            } catch (RuntimeException e) {
                client.observabilitySink().onError(new JsonRpcErrorEvent(Instant.now(),
                        "Listener for '" + member.label() + "' in '" + methodName + "' failed", e));
            }
        }
    }
}

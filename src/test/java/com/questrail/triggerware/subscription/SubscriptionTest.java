package com.questrail.triggerware.subscription;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.triggerware.api.Query;
import com.questrail.triggerware.api.SubscriptionException;
import com.questrail.triggerware.client.TriggerwareClient;
import com.questrail.triggerware.config.TriggerwareClientConfig;
import com.questrail.triggerware.protocol.jsonrpc.HandlerDispatchMode;
import com.questrail.triggerware.protocol.jsonrpc.error.ServerErrorException;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcProtocolEvent;
import com.questrail.triggerware.protocol.jsonrpc.observability.RecordingObservabilitySink;
import com.questrail.triggerware.protocol.jsonrpc.transport.FakeStreamEndpoint;
import com.questrail.triggerware.protocol.jsonrpc.transport.ScriptedServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SubscriptionTest
 * -----------------------------------------------------------------------------
 * The inactive / active part of the {@link Subscription} state machine.
 */
final class SubscriptionTest
{
    private static final Query NEW_FILINGS = Query.fol("((c f) s.t. (new-filing c f))", "SEC");

    private final FakeStreamEndpoint endpoint = new FakeStreamEndpoint();
    private final ScriptedServer server = new ScriptedServer();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final List<JsonNode> received = new ArrayList<>();
    private TriggerwareClient client;

    @BeforeEach
    void setUp()
    {
        endpoint.respondWith(server);
        client = TriggerwareClient.create(endpoint,
                TriggerwareClientConfig.builder().withHandlerDispatch(HandlerDispatchMode.INLINE).build(),
                sink);
        server.on("subscribe", "true");
        server.on("unsubscribe", "true");
    }

    @AfterEach
    void tearDown()
    {
        client.close();
    }

    @Test
    void newSubscriptionIsInactiveWithGeneratedLabel()
    {
        Subscription first = new Subscription(client, NEW_FILINGS, received::add);
        Subscription second = new Subscription(client, NEW_FILINGS, received::add);

        assertEquals(SubscriptionState.INACTIVE, first.state());
        assertFalse(first.isActive());
        assertFalse(first.isBatchMember());
        assertTrue(first.batch().isEmpty());
        assertEquals("sub0", first.label());
        assertEquals("sub1", second.label());
        assertTrue(server.calls().isEmpty());
    }

    @Test
    void activateSubscribesUnderOwnLabelAndDeliversTuples()
    {
        Subscription subscription = new Subscription(client, NEW_FILINGS, received::add);

        subscription.activate();

        JsonNode params = server.calls("subscribe").get(0).params();
        assertEquals("((c f) s.t. (new-filing c f))", params.get("query").asText());
        assertEquals("fol", params.get("language").asText());
        assertEquals("SEC", params.get("namespace").asText());
        assertEquals("sub0", params.get("label").asText());
        assertEquals("sub0", params.get("method").asText());
        assertFalse(params.get("combine").asBoolean());
        assertTrue(subscription.isActive());

        endpoint.inject("{\"jsonrpc\":\"2.0\",\"method\":\"sub0\",\"params\":{\"tuple\":[\"ACME\",\"10-K\"]}}");

        assertEquals(1, received.size());
        assertEquals("ACME", received.get(0).get(0).asText());
    }

    @Test
    void activatingTwiceFails()
    {
        Subscription subscription = new Subscription(client, NEW_FILINGS, received::add);
        subscription.activate();

        SubscriptionException e = assertThrows(SubscriptionException.class, subscription::activate);

        assertEquals("Subscription is already active.", e.getMessage());
        assertEquals(1, server.calls("subscribe").size());
        assertTrue(subscription.isActive());
    }

    @Test
    void deactivateUnsubscribesAndStopsDelivery()
    {
        Subscription subscription = new Subscription(client, NEW_FILINGS, received::add);
        subscription.activate();

        subscription.deactivate();

        JsonNode params = server.calls("unsubscribe").get(0).params();
        assertEquals("sub0", params.get("method").asText());
        assertFalse(params.get("combine").asBoolean());
        assertEquals(SubscriptionState.INACTIVE, subscription.state());
        assertFalse(client.transport().hasMethod("sub0"));

        endpoint.inject("{\"jsonrpc\":\"2.0\",\"method\":\"sub0\",\"params\":{\"tuple\":[1]}}");
        assertTrue(received.isEmpty());
    }

    @Test
    void deactivatingInactiveSubscriptionFails()
    {
        Subscription subscription = new Subscription(client, NEW_FILINGS, received::add);

        SubscriptionException e = assertThrows(SubscriptionException.class, subscription::deactivate);

        assertEquals("Subscription is already inactive.", e.getMessage());
        assertTrue(server.calls().isEmpty());
    }

    @Test
    void subscriptionCanBeReactivated()
    {
        Subscription subscription = new Subscription(client, NEW_FILINGS, received::add);

        subscription.activate();
        subscription.deactivate();
        subscription.activate();

        assertTrue(subscription.isActive());
        assertEquals(2, server.calls("subscribe").size());
    }

    @Test
    void refusedSubscribeLeavesSubscriptionInactiveAndUnregistered()
    {
        server.fail("subscribe", -32602, "query cannot be triggered");
        Subscription subscription = new Subscription(client, NEW_FILINGS, received::add);

        SubscriptionException e = assertThrows(SubscriptionException.class, subscription::activate);

        assertEquals("query cannot be triggered", e.getMessage());
        assertEquals(SubscriptionState.INACTIVE, subscription.state());
        assertFalse(client.transport().hasMethod("sub0"));
    }

    @Test
    void serverErrorOnUnsubscribeIsNotWrappedAndStateIsKept()
    {
        Subscription subscription = new Subscription(client, NEW_FILINGS, received::add);
        subscription.activate();
        server.fail("unsubscribe", -32000, "server busy");

        assertThrows(ServerErrorException.class, subscription::deactivate);

        assertTrue(subscription.isActive());
        assertTrue(client.transport().hasMethod("sub0"));
    }

    @Test
    void notificationRacingSubscribeReplyIsDelivered()
    {
        server.on("subscribe", params -> {
            endpoint.inject("{\"jsonrpc\":\"2.0\",\"method\":\"sub0\",\"params\":{\"tuple\":[\"early\"]}}");
            return ScriptedServer.json("true");
        });
        Subscription subscription = new Subscription(client, NEW_FILINGS, received::add);

        subscription.activate();

        assertEquals(1, received.size());
        assertEquals("early", received.get(0).get(0).asText());
    }

    @Test
    void notificationWithoutTupleIsReported()
    {
        Subscription subscription = new Subscription(client, NEW_FILINGS, received::add);
        subscription.activate();

        endpoint.inject("{\"jsonrpc\":\"2.0\",\"method\":\"sub0\",\"params\":{\"row\":[1]}}");

        assertTrue(received.isEmpty());
        assertEquals(1, sink.getProtocolEvents(JsonRpcProtocolEvent.Kind.UNEXPECTED_PAYLOAD).size());
    }
}

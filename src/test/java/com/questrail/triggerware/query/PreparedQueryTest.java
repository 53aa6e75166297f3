package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.triggerware.api.InvalidQueryException;
import com.questrail.triggerware.api.PreparedQueryException;
import com.questrail.triggerware.api.Query;
import com.questrail.triggerware.api.QueryRestriction;
import com.questrail.triggerware.client.TriggerwareClient;
import com.questrail.triggerware.config.TriggerwareClientConfig;
import com.questrail.triggerware.protocol.jsonrpc.HandlerDispatchMode;
import com.questrail.triggerware.protocol.jsonrpc.observability.NullObservabilitySink;
import com.questrail.triggerware.protocol.jsonrpc.transport.FakeStreamEndpoint;
import com.questrail.triggerware.protocol.jsonrpc.transport.ScriptedServer;
import com.questrail.triggerware.result.ResultCursor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static com.questrail.triggerware.protocol.jsonrpc.transport.ScriptedServer.json;
import static org.junit.jupiter.api.Assertions.*;

final class PreparedQueryTest
{
    private static final String POSITIONAL_SIGNATURE =
            "[{\"attribute\":\"?1\",\"type\":\"integer\"},{\"attribute\":\"?2\",\"type\":\"stringcase\"}]";

    private final FakeStreamEndpoint endpoint = new FakeStreamEndpoint();
    private final ScriptedServer server = new ScriptedServer();
    private final AtomicLong nextHandle = new AtomicLong(11);
    private TriggerwareClient client;

    @BeforeEach
    void setUp()
    {
        endpoint.respondWith(server);
        client = TriggerwareClient.create(endpoint,
                TriggerwareClientConfig.builder().withHandlerDispatch(HandlerDispatchMode.INLINE).build(),
                NullObservabilitySink.INSTANCE);
        server.on("create-resultset", "{\"handle\":90,\"batch\":{\"tuples\":[[1]],\"exhausted\":true}}");
    }

    @AfterEach
    void tearDown()
    {
        client.close();
    }

    private void prepareReturns(String signature, boolean named)
    {
        server.on("prepare-query", params -> {
            ObjectNode reply = JsonNodeFactory.instance.objectNode();
            reply.put("handle", nextHandle.getAndIncrement());
            reply.set("inputSignature", json(signature));
            reply.put("usesNamedParameters", named);
            return reply;
        });
    }

    @Test
    void positionalSqlParametersAreTypeCheckedAndSent()
    {
        prepareReturns(POSITIONAL_SIGNATURE, false);
        PreparedQuery query = new PreparedQuery(client,
                Query.sql("SELECT rate FROM inflation WHERE year = ? AND region = ?"));

        assertEquals(11, query.handle());
        assertEquals(List.of(11L), client.handles());
        assertEquals(List.of("?1", "?2"), query.parameterNames());

        query.setParameter(0, 1991);
        query.setParameter(1, "US");
        ResultCursor cursor = query.execute(new QueryRestriction(50, 2.0));

        JsonNode params = server.calls("create-resultset").get(0).params();
        assertEquals(11, params.get("handle").asLong());
        assertEquals(1991, params.get("inputs").get(0).asInt());
        assertEquals("US", params.get("inputs").get(1).asText());
        assertEquals(50, params.get("limit").asInt());
        assertEquals(2.0, params.get("timelimit").asDouble());
        assertEquals(1, cursor.pull(5).size());
    }

    @Test
    void sqlTypeMismatchIsRejected()
    {
        prepareReturns(POSITIONAL_SIGNATURE, false);
        PreparedQuery query = new PreparedQuery(client, Query.sql("SELECT ..."));

        PreparedQueryException e = assertThrows(PreparedQueryException.class, () -> query.setParameter(0, "1991"));
        assertEquals("Expected type integer, got String", e.getMessage());
        assertThrows(PreparedQueryException.class, () -> query.setParameter(1, 7));
        assertTrue(query.getParameter(0).isNull());
    }

    @Test
    void addressingStyleMustMatchTheQuery()
    {
        prepareReturns(POSITIONAL_SIGNATURE, false);
        PreparedQuery positional = new PreparedQuery(client, Query.sql("SELECT ..."));

        PreparedQueryException byName = assertThrows(PreparedQueryException.class,
                () -> positional.setParameter("?1", 1));
        assertEquals("This query uses positional parameters.", byName.getMessage());
        assertThrows(PreparedQueryException.class, () -> positional.setParameter(2, 1));
        assertThrows(PreparedQueryException.class, () -> positional.getParameter(-1));

        prepareReturns("[{\"attribute\":\"?year\",\"type\":\"integer\"}]", true);
        PreparedQuery named = new PreparedQuery(client, Query.fol("((r) s.t. (inflation ?year ?year r))"));

        PreparedQueryException byPosition = assertThrows(PreparedQueryException.class,
                () -> named.setParameter(0, 1));
        assertEquals("This query uses named parameters.", byPosition.getMessage());
        assertThrows(PreparedQueryException.class, () -> named.getParameter("?month"));
    }

    @Test
    void folParametersSkipTypeCheck()
    {
        prepareReturns("[{\"attribute\":\"?year\",\"type\":\"integer\"}]", true);
        PreparedQuery query = new PreparedQuery(client, Query.fol("((r) s.t. (inflation ?year ?year r))"));

        query.setParameter("?year", "1991");

        assertEquals("1991", query.getParameter("?year").asText());
    }

    @Test
    void unsetParametersAreSentAsNull()
    {
        prepareReturns(POSITIONAL_SIGNATURE, false);
        PreparedQuery query = new PreparedQuery(client, Query.sql("SELECT ..."));
        query.setParameter(1, "US");

        query.execute();

        JsonNode inputs = server.calls("create-resultset").get(0).params().get("inputs");
        assertTrue(inputs.get(0).isNull());
        assertFalse(server.calls("create-resultset").get(0).params().has("limit"));
    }

    @Test
    void copyGetsNewHandleAndKeepsValues()
    {
        prepareReturns(POSITIONAL_SIGNATURE, false);
        PreparedQuery original = new PreparedQuery(client, Query.sql("SELECT ..."));
        original.setParameter(0, 1995);

        PreparedQuery copy = original.copy();
        copy.setParameter(0, 2000);

        assertEquals(12, copy.handle());
        assertEquals(1995, original.getParameter(0).asInt());
        assertEquals(2000, copy.getParameter(0).asInt());
        assertEquals(2, server.calls("prepare-query").size());
    }

    @Test
    void unpreparableQueryIsInvalid()
    {
        server.fail("prepare-query", -32602, "syntax error near WHERE");

        assertThrows(InvalidQueryException.class, () -> new PreparedQuery(client, Query.sql("SELECT WHERE")));
        assertTrue(client.handles().isEmpty());
    }
}

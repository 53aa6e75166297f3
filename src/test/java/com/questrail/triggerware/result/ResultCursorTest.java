package com.questrail.triggerware.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.triggerware.api.InvalidQueryException;
import com.questrail.triggerware.api.Query;
import com.questrail.triggerware.client.TriggerwareClient;
import com.questrail.triggerware.config.TriggerwareClientConfig;
import com.questrail.triggerware.protocol.jsonrpc.HandlerDispatchMode;
import com.questrail.triggerware.protocol.jsonrpc.error.ServerErrorException;
import com.questrail.triggerware.protocol.jsonrpc.observability.NullObservabilitySink;
import com.questrail.triggerware.protocol.jsonrpc.transport.FakeStreamEndpoint;
import com.questrail.triggerware.protocol.jsonrpc.transport.ScriptedServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static com.questrail.triggerware.protocol.jsonrpc.transport.ScriptedServer.json;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ResultCursorTest
 * -----------------------------------------------------------------------------
 * Pagination behavior of {@link ResultCursor} against a scripted server.
 */
final class ResultCursorTest
{
    private final FakeStreamEndpoint endpoint = new FakeStreamEndpoint();
    private final ScriptedServer server = new ScriptedServer();
    private TriggerwareClient client;

    private TriggerwareClient connect(Integer fetchSize, Double timeout)
    {
        endpoint.respondWith(server);
        client = TriggerwareClient.create(endpoint, TriggerwareClientConfig.builder()
                .withHandlerDispatch(HandlerDispatchMode.INLINE)
                .withDefaultFetchSize(fetchSize)
                .withDefaultTimeout(timeout)
                .build(), NullObservabilitySink.INSTANCE);
        return client;
    }

    @AfterEach
    void tearDown()
    {
        if (client != null) {
            client.close();
        }
    }

    @Test
    void inflationQueryPaginatesWithOneFetchPerEmptyCache()
    {
        // GIVEN: a query whose first execution returns one row and a cursor handle
        connect(10, null);
        server.on("validate", "true");
        server.on("execute-query", "{\"handle\":7,\"signature\":[{\"attribute\":\"A\",\"type\":\"double\"}],"
                + "\"batch\":{\"count\":1,\"tuples\":[[3.1]],\"exhausted\":false}}");
        server.on("next-resultset-batch", "{\"batch\":{\"count\":2,\"tuples\":[[2.9],[2.7]],\"exhausted\":true}}");

        ResultCursor cursor = client.executeQuery(Query.fol("((a) s.t. (inflation 1991 1995 a))"));

        JsonNode executed = server.calls("execute-query").get(0).params();
        assertEquals("((a) s.t. (inflation 1991 1995 a))", executed.get("query").asText());
        assertEquals("fol", executed.get("language").asText());
        assertEquals("AP5", executed.get("namespace").asText());
        assertEquals(7L, cursor.handle().orElseThrow());
        assertEquals("A", cursor.signature().get(0).get("attribute").asText());

        // WHEN: the first pull is served from the initial batch
        List<JsonNode> first = cursor.pull(1);
        assertEquals(3.1, first.get(0).get(0).asDouble());
        assertTrue(server.calls("next-resultset-batch").isEmpty());

        // THEN: the second pull triggers exactly one fetch with handle and row limit
        List<JsonNode> second = cursor.pull(1);
        assertEquals(2.9, second.get(0).get(0).asDouble());

        List<ScriptedServer.Call> fetches = server.calls("next-resultset-batch");
        assertEquals(1, fetches.size());
        JsonNode params = fetches.get(0).params();
        assertEquals(7, params.get(0).asLong());
        assertEquals(10, params.get(1).asInt());
        assertTrue(params.get(2).isNull());
        assertTrue(cursor.isExhausted());
    }

    @Test
    void exhaustedCursorServesCacheThenStopsWithoutNetworkCalls()
    {
        connect(2, 1.5);
        server.on("next-resultset-batch", "{\"batch\":{\"tuples\":[[1],[2]],\"exhausted\":true}}");
        ResultCursor cursor = new ResultCursor(client, json("{\"handle\":3,\"batch\":{\"tuples\":[],\"exhausted\":false}}"),
                null, null);

        assertEquals(2, cursor.pull(5).size());
        assertTrue(cursor.isExhausted());
        assertEquals(1.5, server.calls("next-resultset-batch").get(0).params().get(2).asDouble());

        assertTrue(cursor.pull(3).isEmpty());
        assertTrue(cursor.pull(1).isEmpty());
        assertEquals(1, server.calls("next-resultset-batch").size());
        assertTrue(cursor.isExhausted());
    }

    @Test
    void cursorWithoutHandleIsExhaustedFromTheStart()
    {
        connect(null, null);
        ResultCursor cursor = new ResultCursor(client, json("{\"batch\":{\"tuples\":[[1],[2],[3]]}}"), null, null);

        assertTrue(cursor.isExhausted());
        assertTrue(cursor.handle().isEmpty());
        assertEquals(2, cursor.pull(2).size());
        assertEquals(1, cursor.pull(2).size());
        assertTrue(cursor.pull(2).isEmpty());
        assertTrue(server.calls().isEmpty());
    }

    @Test
    void initialExhaustedFlagIsHonored()
    {
        connect(null, null);
        ResultCursor cursor = new ResultCursor(client,
                json("{\"handle\":4,\"batch\":{\"tuples\":[[1]],\"exhausted\":true}}"), null, null);

        assertEquals(1, cursor.pull(10).size());
        assertTrue(server.calls().isEmpty());
    }

    @Test
    void pullReturnsAtMostN()
    {
        connect(null, null);
        ResultCursor cursor = new ResultCursor(client,
                json("{\"batch\":{\"tuples\":[[1],[2],[3],[4]]}}"), null, null);

        assertEquals(3, cursor.pull(3).size());
        assertTrue(cursor.pull(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> cursor.pull(-1));
    }

    @Test
    void emptyFetchedBatchEndsIteration()
    {
        connect(5, null);
        server.on("next-resultset-batch", "{\"batch\":{\"tuples\":[],\"exhausted\":false}}");
        ResultCursor cursor = new ResultCursor(client, json("{\"handle\":9}"), null, null);

        assertFalse(cursor.hasNext());
        assertThrows(NoSuchElementException.class, cursor::next);
        assertEquals(2, server.calls("next-resultset-batch").size());
    }

    @Test
    void explicitRowLimitOverridesClientDefault()
    {
        connect(100, null);
        server.on("next-resultset-batch", "{\"batch\":{\"tuples\":[[1]],\"exhausted\":true}}");
        ResultCursor cursor = new ResultCursor(client, json("{\"handle\":9}"), 25, 4.0);

        cursor.pull(1);

        JsonNode params = server.calls("next-resultset-batch").get(0).params();
        assertEquals(25, params.get(1).asInt());
        assertEquals(4.0, params.get(2).asDouble());
    }

    @Test
    void malformedBatchReplyIsInvalidResponse()
    {
        connect(null, null);
        server.on("next-resultset-batch", "{\"rows\":[]}");
        ResultCursor cursor = new ResultCursor(client, json("{\"handle\":9}"), null, null);

        assertThrows(ServerErrorException.class, cursor::hasNext);
        assertFalse(cursor.isExhausted());
    }

    @Test
    void rejectedExecutionBecomesInvalidQueryException()
    {
        connect(null, null);
        server.on("validate", "true");
        server.fail("execute-query", -32602, "arity mismatch");

        assertThrows(InvalidQueryException.class, () -> client.executeQuery(Query.fol("((x) s.t. (P x y))")));
    }
}

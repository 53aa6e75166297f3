package com.questrail.triggerware.result;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.triggerware.client.TriggerwareClient;
import com.questrail.triggerware.protocol.jsonrpc.error.ServerErrorException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * ResultCursor
 * =============================================================================
 * Forward-only, lazily paginated view over a server-side result set.
 *
 * <h2>Pagination</h2>
 * <p>Rows are served from a local cache. When the cache runs dry and the
 * cursor is not exhausted, exactly one blocking {@code next-resultset-batch}
 * call fetches the next batch, which replaces the cache. An empty batch ends
 * iteration.</p>
 *
 * <h2>Exhaustion</h2>
 * <p>{@link #isExhausted()} only ever moves from {@code false} to
 * {@code true}. A cursor without a server handle is exhausted from the start
 * and serves only its initial rows.</p>
 *
 * <p>Not thread-safe: one caller drives a cursor at a time.</p>
 */
public final class ResultCursor implements Iterator<JsonNode>
{
    static final String NEXT_BATCH = "next-resultset-batch";

    private final TriggerwareClient client;
    private final Long handle;
    private final JsonNode signature;
    private final Integer rowLimit;
    private final Double timeout;

    private List<JsonNode> cache;
    private int position;
    private boolean exhausted;

    /**
     * @param executionResult the reply of an execute call: {@code handle?}, {@code signature?}, {@code batch?}
     * @param rowLimit        rows per fetched batch; {@code null} for the client default
     * @param timeout         seconds per fetch; {@code null} for the client default
     */
    public ResultCursor(TriggerwareClient client, JsonNode executionResult, Integer rowLimit, Double timeout) {
        this.client = Objects.requireNonNull(client, "client");
        Objects.requireNonNull(executionResult, "executionResult");

        JsonNode h = executionResult.path("handle");
        this.handle = h.isIntegralNumber() ? h.asLong() : null;
        this.signature = executionResult.path("signature").isMissingNode()
                ? JsonNodeFactory.instance.arrayNode()
                : executionResult.get("signature");
        this.rowLimit = rowLimit != null ? rowLimit : client.config().defaultFetchSize();
        this.timeout = timeout != null ? timeout : client.config().defaultTimeout();

        JsonNode batch = executionResult.path("batch");
        this.cache = rows(batch.path("tuples"));
        this.position = 0;
        this.exhausted = handle == null || batch.path("exhausted").asBoolean(false);
    }

    public Optional<Long> handle() {
        return Optional.ofNullable(handle);
    }

    public JsonNode signature() {
        return signature;
    }

    public boolean isExhausted() {
        return exhausted;
    }

    /**
     * May block for one batch fetch when the cache is empty.
     */
    @Override
    public boolean hasNext() {
        if (position < cache.size()) {
            return true;
        }
        if (exhausted) {
            return false;
        }
        fetch();
        return position < cache.size();
    }

    @Override
    public JsonNode next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Result set has no more rows");
        }
        return cache.get(position++);
    }

    /**
     * Produce up to {@code n} rows, fewer if the result set ends first.
     */
    public List<JsonNode> pull(int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must not be negative");
        }
        List<JsonNode> rows = new ArrayList<>(Math.min(n, 256));
        while (rows.size() < n && hasNext()) {
            rows.add(next());
        }
        return rows;
    }

    private void fetch() {
        ArrayNode params = JsonNodeFactory.instance.arrayNode();
        params.add(handle);
        params.add(rowLimit);
        params.add(timeout);

        JsonNode batch = client.transport().call(NEXT_BATCH, params).path("batch");
        if (!batch.isObject()) {
            throw new ServerErrorException("Server sent an invalid response to '" + NEXT_BATCH + "'");
        }
        cache = rows(batch.path("tuples"));
        position = 0;
        if (batch.path("exhausted").asBoolean(false)) {
            exhausted = true;
        }
    }

    private static List<JsonNode> rows(JsonNode tuples) {
        if (!tuples.isArray()) {
            return Collections.emptyList();
        }
        List<JsonNode> rows = new ArrayList<>(tuples.size());
        tuples.forEach(rows::add);
        return rows;
    }
}

package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.triggerware.api.InvalidQueryException;
import com.questrail.triggerware.api.PreparedQueryException;
import com.questrail.triggerware.api.Query;
import com.questrail.triggerware.api.QueryLanguage;
import com.questrail.triggerware.api.QueryRestriction;
import com.questrail.triggerware.client.DomainErrors;
import com.questrail.triggerware.client.TriggerwareClient;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcException;
import com.questrail.triggerware.protocol.jsonrpc.error.ServerErrorException;
import com.questrail.triggerware.result.ResultCursor;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * PreparedQuery
 * =============================================================================
 * A query with unbound inputs, compiled once on the server and executed with
 * different parameter values.
 *
 * <h2>Parameter addressing</h2>
 * <p>The server decides whether a query's inputs are addressed by name or by
 * zero-based position; using the other style fails. For SQL queries each
 * value is also checked against the declared input type before it is
 * accepted.</p>
 *
 * <p>Unset parameters are sent as JSON {@code null}.</p>
 */
public final class PreparedQuery
{
    private static final Map<String, Predicate<Object>> SQL_TYPES = Map.ofEntries(
            Map.entry("double", v -> v instanceof Double || v instanceof Float),
            Map.entry("integer", v -> v instanceof Integer || v instanceof Long
                    || v instanceof Short || v instanceof Byte || v instanceof BigInteger),
            Map.entry("number", v -> v instanceof Number),
            Map.entry("boolean", v -> v instanceof Boolean),
            Map.entry("stringcase", v -> v instanceof String),
            Map.entry("stringnocase", v -> v instanceof String),
            Map.entry("stringagnostic", v -> v instanceof String),
            Map.entry("date", v -> v instanceof String),
            Map.entry("time", v -> v instanceof String),
            Map.entry("timestamp", v -> v instanceof String),
            Map.entry("interval", v -> v instanceof String)
    );

    private final TriggerwareClient client;
    private final Query query;
    private final QueryRestriction restriction;

    private final long handle;
    private final List<String> parameterNames;
    private final List<String> parameterTypes;
    private final boolean usesNamedParameters;
    private final JsonNode[] values;

    /**
     * Prepare {@code query} on the server.
     *
     * @throws InvalidQueryException if the server cannot prepare it
     */
    public PreparedQuery(TriggerwareClient client, Query query, QueryRestriction restriction) {
        this.client = Objects.requireNonNull(client, "client");
        this.query = Objects.requireNonNull(query, "query");
        this.restriction = restriction == null ? QueryRestriction.NONE : restriction;

        JsonNode registration;
        try {
            registration = client.transport().call("prepare-query", QueryParameters.base(query, this.restriction));
        } catch (JsonRpcException e) {
            throw DomainErrors.translate(e, InvalidQueryException::new);
        }

        JsonNode h = registration.path("handle");
        if (!h.isIntegralNumber()) {
            throw new ServerErrorException("Server sent an invalid response to 'prepare-query'");
        }
        this.handle = h.asLong();

        List<String> names = new ArrayList<>();
        List<String> types = new ArrayList<>();
        for (JsonNode input : registration.path("inputSignature")) {
            names.add(input.path("attribute").asText());
            types.add(input.path("type").asText());
        }
        this.parameterNames = List.copyOf(names);
        this.parameterTypes = List.copyOf(types);
        this.usesNamedParameters = registration.path("usesNamedParameters").asBoolean(false);
        this.values = new JsonNode[names.size()];
        Arrays.fill(values, JsonNodeFactory.instance.nullNode());

        client.registerHandle(handle);
    }

    public PreparedQuery(TriggerwareClient client, Query query) {
        this(client, query, QueryRestriction.NONE);
    }

    public long handle() {
        return handle;
    }

    public Query query() {
        return query;
    }

    public List<String> parameterNames() {
        return parameterNames;
    }

    public List<String> parameterTypes() {
        return parameterTypes;
    }

    public boolean usesNamedParameters() {
        return usesNamedParameters;
    }

    public void setParameter(int position, Object value) {
        if (usesNamedParameters) {
            throw new PreparedQueryException("This query uses named parameters.");
        }
        bind(checkPosition(position), value);
    }

    public void setParameter(String name, Object value) {
        if (!usesNamedParameters) {
            throw new PreparedQueryException("This query uses positional parameters.");
        }
        bind(indexOf(name), value);
    }

    public JsonNode getParameter(int position) {
        if (usesNamedParameters) {
            throw new PreparedQueryException("This query uses named parameters.");
        }
        return values[checkPosition(position)];
    }

    public JsonNode getParameter(String name) {
        if (!usesNamedParameters) {
            throw new PreparedQueryException("This query uses positional parameters.");
        }
        return values[indexOf(name)];
    }

    public ResultCursor execute() {
        return execute(QueryRestriction.NONE);
    }

    /**
     * Create a result set from the current parameter values.
     *
     * @throws PreparedQueryException if the server rejects the inputs
     */
    public ResultCursor execute(QueryRestriction restriction) {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("handle", handle);
        ArrayNode inputs = params.putArray("inputs");
        for (JsonNode v : values) {
            inputs.add(v);
        }
        QueryParameters.restrict(params, restriction);

        JsonNode result;
        try {
            result = client.transport().call("create-resultset", params);
        } catch (JsonRpcException e) {
            throw DomainErrors.translate(e, PreparedQueryException::new);
        }
        return new ResultCursor(client, result, null, null);
    }

    /**
     * Prepare the same query again under a new server handle, carrying over
     * the current parameter values.
     */
    public PreparedQuery copy() {
        PreparedQuery copy = new PreparedQuery(client, query, restriction);
        System.arraycopy(values, 0, copy.values, 0, Math.min(values.length, copy.values.length));
        return copy;
    }

    private int checkPosition(int position) {
        if (position < 0 || position >= values.length) {
            throw new PreparedQueryException("Invalid parameter name or position.");
        }
        return position;
    }

    private int indexOf(String name) {
        int index = parameterNames.indexOf(name);
        if (index < 0) {
            throw new PreparedQueryException("Invalid parameter name or position.");
        }
        return index;
    }

    private void bind(int index, Object value) {
        if (query.language() == QueryLanguage.SQL) {
            String expected = parameterTypes.get(index);
            Predicate<Object> accepts = SQL_TYPES.get(expected);
            if (accepts == null) {
                throw new PreparedQueryException("Unsupported parameter type " + expected);
            }
            if (!accepts.test(value)) {
                throw new PreparedQueryException("Expected type " + expected + ", got "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
            }
        }
        values[index] = client.mapper().valueToTree(value);
    }
}

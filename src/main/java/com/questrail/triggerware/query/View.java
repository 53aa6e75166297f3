package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.triggerware.api.InvalidQueryException;
import com.questrail.triggerware.api.Query;
import com.questrail.triggerware.api.QueryRestriction;
import com.questrail.triggerware.client.DomainErrors;
import com.questrail.triggerware.client.TriggerwareClient;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcException;
import com.questrail.triggerware.result.ResultCursor;

import java.util.Objects;

/**
 * View
 * -----------------------------------------------------------------------------
 * A reusable, validated query that may be executed any number of times.
 *
 * <p>A view has no server handle; only its parameters are kept locally.
 * Construction validates the query on the server and fails with
 * {@link InvalidQueryException} if it is rejected.</p>
 */
public final class View
{
    private final TriggerwareClient client;
    private final Query query;
    private final ObjectNode baseParameters;

    public View(TriggerwareClient client, Query query, QueryRestriction restriction) {
        this.client = Objects.requireNonNull(client, "client");
        this.query = Objects.requireNonNull(query, "query");
        this.baseParameters = QueryParameters.base(query, restriction);

        client.validateQuery(query);
    }

    public View(TriggerwareClient client, Query query) {
        this(client, query, QueryRestriction.NONE);
    }

    public Query query() {
        return query;
    }

    public ResultCursor execute() {
        return execute(QueryRestriction.NONE);
    }

    /**
     * @param restriction limits for this execution, overriding those given at construction
     * @throws InvalidQueryException if the server rejects the execution
     */
    public ResultCursor execute(QueryRestriction restriction) {
        ObjectNode params = QueryParameters.restrict(baseParameters.deepCopy(), restriction);

        JsonNode result;
        try {
            result = client.transport().call("execute-query", params);
        } catch (JsonRpcException e) {
            throw DomainErrors.translate(e, InvalidQueryException::new);
        }
        return new ResultCursor(client, result, null, null);
    }
}

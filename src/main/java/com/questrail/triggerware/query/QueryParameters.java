package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.triggerware.api.Query;
import com.questrail.triggerware.api.QueryRestriction;

/**
 * Builds the parameter object shared by every server-side query object:
 * {@code {query, language, namespace, limit?, timelimit?}}.
 */
public final class QueryParameters
{
    private QueryParameters() {
    }

    public static ObjectNode base(Query query, QueryRestriction restriction) {
        ObjectNode params = JsonNodeFactory.instance.objectNode();
        params.put("query", query.text());
        params.put("language", query.language().tag());
        params.put("namespace", query.namespace());
        return restrict(params, restriction);
    }

    /**
     * Overlay the non-null limits of {@code restriction} onto {@code params}.
     */
    public static ObjectNode restrict(ObjectNode params, QueryRestriction restriction) {
        if (restriction == null) {
            return params;
        }
        if (restriction.rowLimit() != null) {
            params.put("limit", restriction.rowLimit());
        }
        if (restriction.timeout() != null) {
            params.put("timelimit", restriction.timeout());
        }
        return params;
    }
}

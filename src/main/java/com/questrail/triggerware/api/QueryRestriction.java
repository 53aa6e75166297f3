package com.questrail.triggerware.api;

/**
 * Resource limits for executing a query. Either limit may be {@code null}
 * to leave it to the server or the client default.
 *
 * @param rowLimit maximum rows per batch
 * @param timeout  time limit in seconds
 */
public record QueryRestriction(
        Integer rowLimit,
        Double timeout
) {
    public static final QueryRestriction NONE = new QueryRestriction(null, null);

    public QueryRestriction {
        if (rowLimit != null && rowLimit < 1) {
            throw new IllegalArgumentException("Row limit must be positive");
        }
        if (timeout != null && timeout <= 0) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
    }

    public static QueryRestriction rows(int rowLimit) {
        return new QueryRestriction(rowLimit, null);
    }

    public static QueryRestriction seconds(double timeout) {
        return new QueryRestriction(null, timeout);
    }
}

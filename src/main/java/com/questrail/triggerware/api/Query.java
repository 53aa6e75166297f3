package com.questrail.triggerware.api;

import java.util.Objects;

/**
 * Query
 * -----------------------------------------------------------------------------
 * Immutable description of a query: its text, language, and the namespace
 * (schema) its relation names resolve in.
 *
 * <p>A {@code Query} is a local value only. Views, prepared queries, polled
 * queries, and subscriptions turn it into server-side state.</p>
 */
public record Query(
        String text,
        QueryLanguage language,
        String namespace
) {
    public static final String DEFAULT_NAMESPACE = "AP5";

    public Query {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(language, "language");
        Objects.requireNonNull(namespace, "namespace");
    }

    public static Query fol(String text) {
        return new Query(text, QueryLanguage.FOL, DEFAULT_NAMESPACE);
    }

    public static Query fol(String text, String namespace) {
        return new Query(text, QueryLanguage.FOL, namespace);
    }

    public static Query sql(String text) {
        return new Query(text, QueryLanguage.SQL, DEFAULT_NAMESPACE);
    }

    public static Query sql(String text, String namespace) {
        return new Query(text, QueryLanguage.SQL, namespace);
    }
}

package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The change between two successive evaluations of a polled query.
 */
public record RowsDelta(
        List<JsonNode> added,
        List<JsonNode> deleted
) {
    public RowsDelta {
        added = List.copyOf(added);
        deleted = List.copyOf(deleted);
    }

    public boolean isEmpty() {
        return added.isEmpty() && deleted.isEmpty();
    }
}

package com.questrail.triggerware.api;

import java.util.List;

/**
 * A named group of relations (connectors) the server exposes, as reported by
 * the metadata reflection call.
 */
public record RelDataGroup(
        String name,
        String symbol,
        List<RelDataElement> elements
) {
    public RelDataGroup {
        elements = List.copyOf(elements);
    }
}

package com.questrail.triggerware.api;

import java.util.List;

/**
 * One relation within a {@link RelDataGroup}: its name, its signature, and
 * how it may be used in a query.
 *
 * @param extra an undocumented list the server sends alongside the usage string
 */
public record RelDataElement(
        String name,
        List<String> signatureNames,
        List<String> signatureTypes,
        String usage,
        List<String> extra,
        String description
) {
    public RelDataElement {
        signatureNames = List.copyOf(signatureNames);
        signatureTypes = List.copyOf(signatureTypes);
        extra = List.copyOf(extra);
    }
}

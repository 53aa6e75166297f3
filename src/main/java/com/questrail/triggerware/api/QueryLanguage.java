package com.questrail.triggerware.api;

/**
 * Query languages understood by the server, with their wire tags.
 */
public enum QueryLanguage
{
    FOL("fol"),
    SQL("sql");

    private final String tag;

    QueryLanguage(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

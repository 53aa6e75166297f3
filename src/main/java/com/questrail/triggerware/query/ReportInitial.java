package com.questrail.triggerware.query;

/**
 * Whether the server reports the state established by a polled query's first
 * evaluation, and how.
 */
public enum ReportInitial
{
    NONE("none"),
    WITH_DELTA("with delta"),
    WITHOUT_DELTA("without delta");

    private final String tag;

    ReportInitial(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}

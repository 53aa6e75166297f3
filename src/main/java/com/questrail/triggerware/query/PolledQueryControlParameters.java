package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Reporting controls for a polled query.
 *
 * @param reportUnchanged notify even when a poll finds no change
 * @param reportInitial   how to report the initial state
 * @param delay           defer the first evaluation to the first scheduled poll
 */
public record PolledQueryControlParameters(
        boolean reportUnchanged,
        ReportInitial reportInitial,
        boolean delay
) {
    public static final PolledQueryControlParameters DEFAULTS =
            new PolledQueryControlParameters(false, ReportInitial.NONE, false);

    public PolledQueryControlParameters {
        Objects.requireNonNull(reportInitial, "reportInitial");
    }

    void writeTo(ObjectNode params) {
        params.put("report-initial", reportInitial.tag());
        params.put("report-unchanged", reportUnchanged);
        params.put("delay", delay);
    }
}

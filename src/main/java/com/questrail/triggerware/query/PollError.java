package com.questrail.triggerware.query;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A poll that did not produce a delta: a data source failed, the time limit
 * expired, or the poll was skipped because the previous one was still
 * running.
 *
 * @param error the server's error payload, as sent
 */
public record PollError(
        String method,
        JsonNode error
) {
    /**
     * Best-effort human readable description.
     */
    public String message() {
        if (error.isTextual()) {
            return error.asText();
        }
        JsonNode message = error.path("message");
        return message.isMissingNode() ? error.toString() : message.asText();
    }
}

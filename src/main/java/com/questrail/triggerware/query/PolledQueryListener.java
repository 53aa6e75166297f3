package com.questrail.triggerware.query;

/**
 * Capability interface for receiving the results of a polled query.
 *
 * <p>Callbacks run on the connection's handler task, one at a time, in the
 * order the server sent them.</p>
 */
public interface PolledQueryListener
{
    void onDelta(RowsDelta delta);

    /**
     * A poll failed or was skipped. Polling continues on schedule.
     *
     * <p>The default does nothing; the condition has already been reported to
     * the client's observability sink.</p>
     */
    default void onPollError(PollError error) {
    }
}

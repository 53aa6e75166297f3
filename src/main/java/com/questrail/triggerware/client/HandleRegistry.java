package com.questrail.triggerware.client;

import java.util.ArrayList;
import java.util.List;

/**
 * Append-only record of the server handles created over one connection.
 *
 * <p>No release call exists for handles; they live as long as the server
 * session does.</p>
 */
public final class HandleRegistry
{
    private final List<Long> handles = new ArrayList<>();

    public synchronized void register(long handle) {
        handles.add(handle);
    }

    public synchronized List<Long> snapshot() {
        return List.copyOf(handles);
    }
}

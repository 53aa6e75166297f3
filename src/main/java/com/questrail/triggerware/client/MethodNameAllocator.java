package com.questrail.triggerware.client;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Allocates inbound callback method names for one connection.
 *
 * <p>Each prefix has its own counter starting at zero, so the first polled
 * query of a connection is {@code poll0} and the first subscription is
 * {@code sub0}. Names are unique per connection, which is the only scope the
 * server routes by.</p>
 */
public final class MethodNameAllocator
{
    public static final String POLLED_QUERY = "poll";
    public static final String SUBSCRIPTION = "sub";
    public static final String BATCH = "batch";

    private final ConcurrentMap<String, AtomicLong> counters = new ConcurrentHashMap<>();

    public String allocate(String prefix) {
        Objects.requireNonNull(prefix, "prefix");
        long n = counters.computeIfAbsent(prefix, p -> new AtomicLong()).getAndIncrement();
        return prefix + n;
    }
}

package com.questrail.triggerware.protocol.jsonrpc.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * FakeStreamEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link StreamEndpoint} implementation.
 *
 * <p>Stores outbound payloads and lets tests inject inbound bytes in any
 * chunking. An optional responder answers each outbound request
 * synchronously, from inside {@link #send(byte[])}, which keeps tests
 * deterministic.</p>
 *
 * <p>Injection is serialized, as a real receive task would be. A responder
 * must not be combined with handlers that call back into the server while
 * running inline, since that would re-enter the frame decoder.</p>
 */
public final class FakeStreamEndpoint implements StreamEndpoint {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private volatile StreamEndpointListener listener;
    private volatile Function<JsonNode, JsonNode> responder;
    private final List<byte[]> sent = new CopyOnWriteArrayList<>();
    private final AtomicBoolean stopped = new AtomicBoolean();

    @Override
    public void setListener(StreamEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start() {
        if (listener != null) {
            listener.onTransportUp();
        }
    }

    @Override
    public void stop() {
        if (stopped.compareAndSet(false, true) && listener != null) {
            listener.onTransportDown(null);
        }
    }

    @Override
    public void send(byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        if (stopped.get()) {
            throw new IllegalStateException("Endpoint is not connected");
        }
        sent.add(payload);

        Function<JsonNode, JsonNode> r = responder;
        if (r == null) {
            return;
        }
        JsonNode message = parse(payload);
        if (message.has("id") && message.has("method")) {
            JsonNode reply = r.apply(message);
            if (reply != null) {
                inject(reply);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void respondWith(Function<JsonNode, JsonNode> responder) {
        this.responder = responder;
    }

    public synchronized void injectBytes(byte[] chunk) {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        listener.onBytes(chunk);
    }

    public void inject(String text) {
        injectBytes(text.getBytes(StandardCharsets.UTF_8));
    }

    public void inject(JsonNode message) {
        try {
            injectBytes(MAPPER.writeValueAsBytes(message));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Simulate the peer dropping the connection.
     */
    public void dropConnection(Throwable cause) {
        if (stopped.compareAndSet(false, true) && listener != null) {
            listener.onTransportDown(cause);
        }
    }

    public List<byte[]> sent() {
        return List.copyOf(sent);
    }

    public List<JsonNode> sentMessages() {
        List<JsonNode> messages = new ArrayList<>();
        for (byte[] payload : sent) {
            messages.add(parse(payload));
        }
        return messages;
    }

    /**
     * Block until at least {@code count} payloads have been sent.
     */
    public List<JsonNode> awaitSent(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (sent.size() < count) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Expected " + count + " sent messages, saw " + sent.size());
            }
            Thread.sleep(5);
        }
        return sentMessages();
    }

    public void clear() {
        sent.clear();
    }

    private static JsonNode parse(byte[] payload) {
        try {
            return MAPPER.readTree(payload);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}

package com.questrail.triggerware.protocol.jsonrpc.codec.impl;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.async.ByteArrayFeeder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.util.TokenBuffer;
import com.questrail.triggerware.protocol.jsonrpc.codec.JsonFrameDecoder;
import com.questrail.triggerware.protocol.jsonrpc.codec.JsonFrameException;

import java.io.IOException;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * DefaultJsonFrameDecoder
 * -----------------------------------------------------------------------------
 * {@link JsonFrameDecoder} backed by Jackson's non-blocking byte-array parser.
 *
 * <p>This decoder performs the following steps for each chunk, in order:</p>
 * <ol>
 *   <li>Feed the chunk to the async parser</li>
 *   <li>Pull tokens until the parser reports {@link JsonToken#NOT_AVAILABLE}</li>
 *   <li>Copy tokens of the current root value into a {@link TokenBuffer},
 *       tracking nesting depth</li>
 *   <li>When depth returns to zero, materialize the buffered tokens as a tree</li>
 * </ol>
 *
 * <p>The async parser suspends at any byte position (inside strings, numbers,
 * literals, or multi-byte UTF-8 sequences), so "incomplete" is never confused
 * with "malformed". Whitespace between root values is skipped by the parser.</p>
 */
public final class DefaultJsonFrameDecoder implements JsonFrameDecoder
{
    private final ObjectMapper mapper;

    private JsonParser parser;
    private TokenBuffer pending;
    private int depth;

    public DefaultJsonFrameDecoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        reset();
    }

    @Override
    public void decode(byte[] chunk, Consumer<JsonNode> sink)
    {
        Objects.requireNonNull(chunk, "chunk");
        Objects.requireNonNull(sink, "sink");
        if (chunk.length == 0) {
            return;
        }

        try {
            ((ByteArrayFeeder) parser.getNonBlockingInputFeeder()).feedInput(chunk, 0, chunk.length);

            JsonToken token;
            while ((token = parser.nextToken()) != null && token != JsonToken.NOT_AVAILABLE) {
                if (pending == null) {
                    pending = new TokenBuffer(mapper, false);
                }
                pending.copyCurrentEvent(parser);

                if (token.isStructStart()) {
                    depth++;
                }
                else if (token.isStructEnd()) {
                    depth--;
                }

                if (depth == 0) {
                    JsonNode value = mapper.readTree(pending.asParser());
                    pending = null;
                    sink.accept(value);
                }
            }
        }
        catch (IOException e) {
            // Parser state is unusable after a syntax error; start over with the next chunk.
            reset();
            throw new JsonFrameException("Malformed JSON in inbound stream: " + e.getMessage(), e);
        }
    }

    @Override
    public boolean hasPartialFrame()
    {
        return pending != null;
    }

    private void reset()
    {
        try {
            parser = mapper.getFactory().createNonBlockingByteArrayParser();
        }
        catch (IOException e) {
            throw new IllegalStateException("Jackson factory cannot create a non-blocking parser", e);
        }
        pending = null;
        depth = 0;
    }
}

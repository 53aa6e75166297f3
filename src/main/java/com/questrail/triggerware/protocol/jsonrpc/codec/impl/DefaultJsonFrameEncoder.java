package com.questrail.triggerware.protocol.jsonrpc.codec.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.triggerware.protocol.jsonrpc.codec.JsonFrameEncoder;
import com.questrail.triggerware.protocol.jsonrpc.error.InternalErrorException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Writes each value as compact UTF-8 JSON followed by a single newline.
 */
public final class DefaultJsonFrameEncoder implements JsonFrameEncoder
{
    private static final byte SEPARATOR = '\n';

    private final ObjectMapper mapper;

    public DefaultJsonFrameEncoder(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public byte[] encode(JsonNode value)
    {
        Objects.requireNonNull(value, "value");
        final byte[] json;
        try {
            json = mapper.writeValueAsBytes(value);
        }
        catch (JsonProcessingException e) {
            throw new InternalErrorException("Failed to serialize outbound message", e);
        }
        byte[] framed = Arrays.copyOf(json, json.length + 1);
        framed[json.length] = SEPARATOR;
        return framed;
    }
}

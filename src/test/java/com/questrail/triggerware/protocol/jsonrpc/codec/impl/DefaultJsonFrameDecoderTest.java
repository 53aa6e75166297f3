package com.questrail.triggerware.protocol.jsonrpc.codec.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.triggerware.protocol.jsonrpc.codec.JsonFrameException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DefaultJsonFrameDecoder}.
 *
 * <p>Chunk boundaries must carry no meaning: one value may span many reads
 * and one read may hold many values.</p>
 */
final class DefaultJsonFrameDecoderTest
{
    private final DefaultJsonFrameDecoder decoder = new DefaultJsonFrameDecoder(new ObjectMapper());
    private final List<JsonNode> decoded = new ArrayList<>();

    private void feed(String text)
    {
        decoder.decode(text.getBytes(StandardCharsets.UTF_8), decoded::add);
    }

    @Test
    void messageSplitAcrossThreeReadsIsDecodedOnce()
    {
        feed("{\"jsonrpc\":\"2.0\",");
        assertTrue(decoded.isEmpty());
        assertTrue(decoder.hasPartialFrame());

        feed("\"id\":7,\"res");
        assertTrue(decoded.isEmpty());

        feed("ult\":[1,2,3]}");

        assertEquals(1, decoded.size());
        assertEquals(7, decoded.get(0).get("id").asInt());
        assertEquals(3, decoded.get(0).get("result").size());
        assertFalse(decoder.hasPartialFrame());
    }

    @Test
    void twoConcatenatedMessagesInOneReadAreBothDecoded()
    {
        feed("{\"jsonrpc\":\"2.0\",\"id\":0,\"result\":1}{\"jsonrpc\":\"2.0\",\"method\":\"poll0\",\"params\":{}}");

        assertEquals(2, decoded.size());
        assertEquals(0, decoded.get(0).get("id").asInt());
        assertEquals("poll0", decoded.get(1).get("method").asText());
    }

    @Test
    void whitespaceBetweenMessagesIsSkipped()
    {
        feed("  {\"a\":1}\n\n\t{\"b\":2}\r\n ");

        assertEquals(2, decoded.size());
        assertFalse(decoder.hasPartialFrame());
    }

    @Test
    void splitInsideLiteralAndStringResumes()
    {
        feed("{\"ok\":tr");
        feed("ue,\"name\":\"infl");
        feed("ation\",\"none\":nu");
        feed("ll}");

        assertEquals(1, decoded.size());
        JsonNode value = decoded.get(0);
        assertTrue(value.get("ok").asBoolean());
        assertEquals("inflation", value.get("name").asText());
        assertTrue(value.get("none").isNull());
    }

    @Test
    void multiByteCharacterSplitAcrossReads()
    {
        byte[] bytes = "{\"city\":\"Zürich\"}".getBytes(StandardCharsets.UTF_8);
        int split = "{\"city\":\"Z".length() + 1; // inside the two-byte ü

        decoder.decode(Arrays.copyOfRange(bytes, 0, split), decoded::add);
        decoder.decode(Arrays.copyOfRange(bytes, split, bytes.length), decoded::add);

        assertEquals(1, decoded.size());
        assertEquals("Zürich", decoded.get(0).get("city").asText());
    }

    @Test
    void byteAtATimeDeliveryStillYieldsEveryMessage()
    {
        byte[] bytes = "{\"id\":1,\"result\":{\"x\":[1,{\"y\":2}]}} {\"id\":2,\"result\":null}"
                .getBytes(StandardCharsets.UTF_8);
        for (byte b : bytes) {
            decoder.decode(new byte[] { b }, decoded::add);
        }

        assertEquals(2, decoded.size());
        assertEquals(2, decoded.get(0).get("result").get("x").get(1).get("y").asInt());
        assertTrue(decoded.get(1).get("result").isNull());
    }

    @Test
    void malformedInputIsReportedAndStreamRecovers()
    {
        assertThrows(JsonFrameException.class, () -> feed("{\"id\":1,\"result\":}"));
        assertFalse(decoder.hasPartialFrame());

        feed("{\"id\":2,\"result\":true}");

        assertEquals(1, decoded.size());
        assertEquals(2, decoded.get(0).get("id").asInt());
    }

    @Test
    void emptyChunkIsIgnored()
    {
        decoder.decode(new byte[0], decoded::add);
        assertTrue(decoded.isEmpty());
        assertFalse(decoder.hasPartialFrame());
    }
}

package com.questrail.triggerware.protocol.jsonrpc.internal.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcErrorCodes;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcException;

import java.util.Optional;

/**
 * Indicates that a decoded JSON value could not be translated into a valid
 * JSON-RPC envelope.
 *
 * This typically reflects:
 * <ul>
 *   <li>A value that is not a JSON object</li>
 *   <li>A missing or unsupported {@code jsonrpc} version</li>
 *   <li>An envelope with neither {@code id} nor {@code method}</li>
 *   <li>An ill-typed {@code method} or {@code error} member</li>
 * </ul>
 *
 * <p>When the offending value looked like an inbound call, {@link #replyId()}
 * holds its id so the transport can answer with an error reply. When it looked
 * like a reply to one of our calls, {@link #responseId()} holds its id so the
 * waiting caller can be failed.</p>
 */
public final class JsonRpcDecodeException extends JsonRpcException
{
    private final JsonNode replyId;
    private final JsonNode responseId;

    public JsonRpcDecodeException(String message) {
        this(message, null);
    }

    public JsonRpcDecodeException(String message, JsonNode replyId) {
        this(message, replyId, null);
    }

    private JsonRpcDecodeException(String message, JsonNode replyId, JsonNode responseId) {
        super(JsonRpcErrorCodes.INVALID_REQUEST, message);
        this.replyId = replyId;
        this.responseId = responseId;
    }

    /**
     * A rejected envelope that carried an {@code id} but no {@code method}.
     */
    public static JsonRpcDecodeException forResponse(String message, JsonNode responseId) {
        return new JsonRpcDecodeException(message, null, responseId);
    }

    public Optional<JsonNode> replyId() {
        return Optional.ofNullable(replyId);
    }

    public Optional<JsonNode> responseId() {
        return Optional.ofNullable(responseId);
    }
}

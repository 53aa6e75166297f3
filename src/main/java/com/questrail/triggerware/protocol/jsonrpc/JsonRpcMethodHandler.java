package com.questrail.triggerware.protocol.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * JsonRpcMethodHandler
 * -----------------------------------------------------------------------------
 * The pair of callbacks registered under one inbound method name.
 *
 * <p>The server may address a method either as a call (with an id, expecting
 * a reply) or as a notification (no id). {@link #execute(JsonNode)} answers the
 * former; its return value becomes the {@code result} of the reply.
 * {@link #handleNotification(JsonNode)} consumes the latter.</p>
 *
 * <p>Handlers run on the transport's handler task, in wire order. A handler
 * that throws a {@code JsonRpcException} from {@code execute} is answered with
 * that error; any other exception is answered with an internal error.</p>
 */
public interface JsonRpcMethodHandler
{
    JsonNode execute(JsonNode params);

    void handleNotification(JsonNode params);

    static JsonRpcMethodHandler of(Function<JsonNode, JsonNode> execute, Consumer<JsonNode> notification)
    {
        Objects.requireNonNull(execute, "execute");
        Objects.requireNonNull(notification, "notification");
        return new JsonRpcMethodHandler() {
            @Override
            public JsonNode execute(JsonNode params) {
                return execute.apply(params);
            }

            @Override
            public void handleNotification(JsonNode params) {
                notification.accept(params);
            }
        };
    }

    /**
     * A handler for callback methods the server only notifies. An inbound call
     * on the same name is acknowledged with an empty object.
     */
    static JsonRpcMethodHandler forNotifications(Consumer<JsonNode> notification)
    {
        return of(params -> JsonNodeFactory.instance.objectNode(), notification);
    }
}

package com.questrail.triggerware.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.questrail.triggerware.api.InvalidQueryException;
import com.questrail.triggerware.api.Query;
import com.questrail.triggerware.api.QueryRestriction;
import com.questrail.triggerware.api.RelDataElement;
import com.questrail.triggerware.api.RelDataGroup;
import com.questrail.triggerware.config.TriggerwareClientConfig;
import com.questrail.triggerware.protocol.jsonrpc.JsonRpcTransport;
import com.questrail.triggerware.protocol.jsonrpc.error.JsonRpcException;
import com.questrail.triggerware.protocol.jsonrpc.error.ServerErrorException;
import com.questrail.triggerware.protocol.jsonrpc.observability.JsonRpcObservabilitySink;
import com.questrail.triggerware.protocol.jsonrpc.observability.Slf4jJsonRpcObservabilitySink;
import com.questrail.triggerware.protocol.jsonrpc.transport.StreamEndpoint;
import com.questrail.triggerware.protocol.jsonrpc.transport.tcp.netty.NettyTcpStreamEndpoint;
import com.questrail.triggerware.query.View;
import com.questrail.triggerware.result.ResultCursor;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * TriggerwareClient
 * =============================================================================
 * Composition root and lifecycle owner for one connection to a Triggerware
 * server.
 *
 * <p>The client owns the {@link JsonRpcTransport}, the per-connection
 * {@link MethodNameAllocator} and {@link HandleRegistry}, and the defaults
 * from {@link TriggerwareClientConfig}. Every stateful protocol object
 * (views, prepared and polled queries, cursors, subscriptions) holds an
 * explicit reference to the client it was built from.</p>
 *
 * <p>Connection loss is terminal: a closed client cannot be reopened.</p>
 */
public final class TriggerwareClient implements AutoCloseable
{
    private final JsonRpcTransport transport;
    private final TriggerwareClientConfig config;
    private final ObjectMapper mapper;
    private final JsonRpcObservabilitySink observabilitySink;

    private final MethodNameAllocator names = new MethodNameAllocator();
    private final HandleRegistry handles = new HandleRegistry();

    private TriggerwareClient(JsonRpcTransport transport,
                              TriggerwareClientConfig config,
                              ObjectMapper mapper,
                              JsonRpcObservabilitySink observabilitySink) {
        this.transport = transport;
        this.config = config;
        this.mapper = mapper;
        this.observabilitySink = observabilitySink;
    }

    /**
     * Wire a client over an arbitrary endpoint and open it.
     *
     * @throws ServerErrorException if the endpoint cannot be started
     */
    public static TriggerwareClient create(StreamEndpoint endpoint,
                                           TriggerwareClientConfig config,
                                           JsonRpcObservabilitySink sink) {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(sink, "sink");

        ObjectMapper mapper = new ObjectMapper();
        JsonRpcTransport transport = new JsonRpcTransport(
                endpoint, mapper, config.handlerDispatch(), config.callTimeout(), sink);
        transport.start();
        return new TriggerwareClient(transport, config, mapper, sink);
    }

    public static Builder builder() {
        return new Builder();
    }

    public JsonRpcTransport transport() {
        return transport;
    }

    public TriggerwareClientConfig config() {
        return config;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonRpcObservabilitySink observabilitySink() {
        return observabilitySink;
    }

    /**
     * Allocate a fresh inbound method name (e.g. {@code poll3}) for this connection.
     */
    public String allocateMethodName(String prefix) {
        return names.allocate(prefix);
    }

    public void registerHandle(long handle) {
        handles.register(handle);
    }

    public List<Long> handles() {
        return handles.snapshot();
    }

    // -------------------------------------------------------------------------
    // One-shot operations
    // -------------------------------------------------------------------------

    /**
     * Execute a query once and return a cursor over its rows.
     */
    public ResultCursor executeQuery(Query query, QueryRestriction restriction) {
        return new View(this, query, restriction).execute();
    }

    public ResultCursor executeQuery(Query query) {
        return executeQuery(query, QueryRestriction.NONE);
    }

    /**
     * Ask the server whether {@code query} is well-formed in its language and namespace.
     *
     * @throws InvalidQueryException if the server rejects it
     */
    public void validateQuery(Query query) {
        ArrayNode params = JsonNodeFactory.instance.arrayNode()
                .add(query.text())
                .add(query.language().tag())
                .add(query.namespace());
        try {
            transport.call("validate", params);
        } catch (JsonRpcException e) {
            throw DomainErrors.translate(e, InvalidQueryException::new);
        }
    }

    /**
     * Describe the relations (connectors) the server exposes.
     */
    public List<RelDataGroup> relData() {
        JsonNode result = transport.call("reldata2017", JsonNodeFactory.instance.arrayNode());
        if (!result.isArray()) {
            throw new ServerErrorException("Server sent an invalid response to 'reldata2017'");
        }

        List<RelDataGroup> groups = new ArrayList<>();
        for (JsonNode group : result) {
            List<RelDataElement> elements = new ArrayList<>();
            for (int i = 2; i < group.size(); i++) {
                elements.add(toElement(group.get(i)));
            }
            groups.add(new RelDataGroup(group.path(0).asText(), group.path(1).asText(), elements));
        }
        return groups;
    }

    private static RelDataElement toElement(JsonNode raw) {
        return new RelDataElement(
                raw.path(0).asText(),
                texts(raw.path(1)),
                texts(raw.path(2)),
                raw.path(3).asText(),
                texts(raw.path(4)),
                raw.path(5).asText());
    }

    private static List<String> texts(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> out.add(n.asText()));
        }
        return out;
    }

    /**
     * Close the connection. Pending calls fail with a connection-closed error.
     * Idempotent.
     */
    @Override
    public void close() {
        transport.close();
    }

    public boolean isClosed() {
        return transport.isClosed();
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static final class Builder {
        private TriggerwareClientConfig config = TriggerwareClientConfig.builder().build();
        private JsonRpcObservabilitySink observabilitySink = new Slf4jJsonRpcObservabilitySink();

        public Builder withConfig(TriggerwareClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(JsonRpcObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Connect over TCP to the configured host and port.
         */
        public TriggerwareClient connect() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            StreamEndpoint endpoint = new NettyTcpStreamEndpoint(
                    new InetSocketAddress(config.host(), config.port()),
                    config.connectTimeout());
            return create(endpoint, config, observabilitySink);
        }
    }
}

package com.questrail.triggerware.config;

import com.questrail.triggerware.protocol.jsonrpc.HandlerDispatchMode;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for a Triggerware client connection.
 *
 * @param defaultFetchSize row limit for result cursors that do not specify one; {@code null} leaves it to the server
 * @param defaultTimeout   seconds sent as the time limit when none is specified; {@code null} leaves it to the server
 * @param callTimeout      client-side deadline for every call; {@code null} waits until reply or close
 */
public record TriggerwareClientConfig(
    String host,
    int port,
    Integer defaultFetchSize,
    Double defaultTimeout,
    Duration callTimeout,
    Duration connectTimeout,
    HandlerDispatchMode handlerDispatch
) {
    public TriggerwareClientConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(handlerDispatch, "handlerDispatch");
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("Port must be 1-65535");
        }
        if (defaultFetchSize != null && defaultFetchSize < 1) {
            throw new IllegalArgumentException("Default fetch size must be positive");
        }
        if (defaultTimeout != null && defaultTimeout <= 0) {
            throw new IllegalArgumentException("Default timeout must be positive");
        }
        if (callTimeout != null && (callTimeout.isNegative() || callTimeout.isZero())) {
            throw new IllegalArgumentException("Call timeout must be positive");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String host = "localhost";
        private int port = 5221;
        private Integer defaultFetchSize;
        private Double defaultTimeout;
        private Duration callTimeout;
        private Duration connectTimeout = Duration.ofSeconds(10);
        private HandlerDispatchMode handlerDispatch = HandlerDispatchMode.SERIAL_EXECUTOR;

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withDefaultFetchSize(Integer fetchSize) {
            this.defaultFetchSize = fetchSize;
            return this;
        }

        public Builder withDefaultTimeout(Double seconds) {
            this.defaultTimeout = seconds;
            return this;
        }

        public Builder withCallTimeout(Duration timeout) {
            this.callTimeout = timeout;
            return this;
        }

        public Builder withConnectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder withHandlerDispatch(HandlerDispatchMode mode) {
            this.handlerDispatch = mode;
            return this;
        }

        public TriggerwareClientConfig build() {
            return new TriggerwareClientConfig(host, port, defaultFetchSize, defaultTimeout,
                    callTimeout, connectTimeout, handlerDispatch);
        }
    }
}

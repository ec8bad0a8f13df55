package com.questrail.msgrpc.config;

import com.questrail.msgrpc.msgpack.ExtensionRegistry;
import com.questrail.msgrpc.observability.RpcObservabilitySink;
import com.questrail.msgrpc.observability.Slf4jRpcObservabilitySink;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;

/**
 * Aggregated configuration for an RPC endpoint.
 *
 * @param closeGracePeriod  how long {@code close()} waits for the peer process
 *                          and the read loop before giving up
 * @param dispatchExecutor  runs inbound handlers; {@code null} makes the
 *                          endpoint create and own a cached daemon pool
 * @param observabilitySink receives protocol, handler and transport events
 * @param extensions        application extension codecs
 * @param batchMethod       method name that executes an atomic batch
 */
public record EndpointConfig(
    Duration closeGracePeriod,
    ExecutorService dispatchExecutor,
    RpcObservabilitySink observabilitySink,
    ExtensionRegistry extensions,
    String batchMethod
) {
    public static final Duration DEFAULT_CLOSE_GRACE_PERIOD = Duration.ofSeconds(10);
    public static final String DEFAULT_BATCH_METHOD = "nvim_call_atomic";

    public EndpointConfig {
        Objects.requireNonNull(closeGracePeriod, "closeGracePeriod");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(extensions, "extensions");
        Objects.requireNonNull(batchMethod, "batchMethod");
        if (closeGracePeriod.isNegative()) {
            throw new IllegalArgumentException("closeGracePeriod must not be negative");
        }
    }

    public static EndpointConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration closeGracePeriod = DEFAULT_CLOSE_GRACE_PERIOD;
        private ExecutorService dispatchExecutor;
        private RpcObservabilitySink observabilitySink;
        private ExtensionRegistry extensions = ExtensionRegistry.empty();
        private String batchMethod = DEFAULT_BATCH_METHOD;

        public Builder withCloseGracePeriod(Duration closeGracePeriod) {
            this.closeGracePeriod = closeGracePeriod;
            return this;
        }

        public Builder withDispatchExecutor(ExecutorService dispatchExecutor) {
            this.dispatchExecutor = dispatchExecutor;
            return this;
        }

        public Builder withObservabilitySink(RpcObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public Builder withExtensions(ExtensionRegistry extensions) {
            this.extensions = extensions;
            return this;
        }

        public Builder withBatchMethod(String batchMethod) {
            this.batchMethod = batchMethod;
            return this;
        }

        public EndpointConfig build() {
            RpcObservabilitySink sink = observabilitySink != null
                    ? observabilitySink
                    : new Slf4jRpcObservabilitySink();
            return new EndpointConfig(closeGracePeriod, dispatchExecutor, sink, extensions, batchMethod);
        }
    }
}

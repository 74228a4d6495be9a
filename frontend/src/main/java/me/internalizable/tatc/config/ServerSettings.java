package me.internalizable.tatc.config;

import me.internalizable.tatc.trust.TrustConfig;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.Objects;

/**
 * Validated, immutable startup configuration of the front end.
 *
 * <p>Built once from {@link FrontendConfig#toSettings()} and passed to every component that needs
 * it; nothing mutates it afterwards.</p>
 *
 * @param bindAddress interface to bind, {@code 0.0.0.0} for all
 * @param port TCP port to listen on, {@code 0} for an ephemeral port
 * @param requestTimeout how long a handler may run before its connection is closed
 * @param shutdownGracePeriod how long shutdown waits for in-flight requests
 * @param maxConnections connections beyond this are closed on accept
 * @param maxContentLength largest request body accepted, in bytes
 * @param handlerThreads size of the handler worker pool
 * @param trustConfig forwarding header rules
 */
public record ServerSettings(
        @Nonnull String bindAddress,
        int port,
        @Nonnull Duration requestTimeout,
        @Nonnull Duration shutdownGracePeriod,
        int maxConnections,
        int maxContentLength,
        int handlerThreads,
        @Nonnull TrustConfig trustConfig
) {

    public static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";
    public static final int DEFAULT_PORT = 3000;

    public ServerSettings {
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(requestTimeout, "requestTimeout");
        Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod");
        Objects.requireNonNull(trustConfig, "trustConfig");
        if (bindAddress.isBlank()) {
            throw new ConfigurationException("bind address must not be blank");
        }
        if (port < 0 || port > 0xFFFF) {
            throw new ConfigurationException("port must be between 0 and 65535, got " + port);
        }
        if (requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new ConfigurationException("request timeout must be positive, got " + requestTimeout);
        }
        if (shutdownGracePeriod.isNegative()) {
            throw new ConfigurationException("shutdown grace period must not be negative, got " + shutdownGracePeriod);
        }
        if (maxConnections < 1) {
            throw new ConfigurationException("maxConnections must be at least 1, got " + maxConnections);
        }
        if (maxContentLength < 0) {
            throw new ConfigurationException("maxContentLength must not be negative, got " + maxContentLength);
        }
        if (handlerThreads < 1) {
            throw new ConfigurationException("handlerThreads must be at least 1, got " + handlerThreads);
        }
    }

    /**
     * Defaults with the given port and trust rules, mostly for embedding and tests.
     */
    @Nonnull
    public static ServerSettings defaults(int port, @Nonnull TrustConfig trustConfig) {
        FrontendConfig config = new FrontendConfig();
        return new ServerSettings(DEFAULT_BIND_ADDRESS, port,
                Duration.ofSeconds(config.getRequestTimeoutSeconds()),
                Duration.ofSeconds(config.getShutdownGracePeriodSeconds()),
                config.getMaxConnections(),
                config.getMaxContentLength(),
                config.getHandlerThreads(),
                trustConfig);
    }

    @Nonnull
    public ServerSettings withBindAddress(@Nonnull String bindAddress) {
        return new ServerSettings(bindAddress, port, requestTimeout, shutdownGracePeriod,
                maxConnections, maxContentLength, handlerThreads, trustConfig);
    }

    @Nonnull
    public ServerSettings withRequestTimeout(@Nonnull Duration requestTimeout) {
        return new ServerSettings(bindAddress, port, requestTimeout, shutdownGracePeriod,
                maxConnections, maxContentLength, handlerThreads, trustConfig);
    }

    @Nonnull
    public ServerSettings withShutdownGracePeriod(@Nonnull Duration shutdownGracePeriod) {
        return new ServerSettings(bindAddress, port, requestTimeout, shutdownGracePeriod,
                maxConnections, maxContentLength, handlerThreads, trustConfig);
    }

    @Nonnull
    public ServerSettings withMaxConnections(int maxConnections) {
        return new ServerSettings(bindAddress, port, requestTimeout, shutdownGracePeriod,
                maxConnections, maxContentLength, handlerThreads, trustConfig);
    }
}

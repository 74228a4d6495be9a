package me.internalizable.tatc.pipeline;

import io.netty.channel.ChannelInitializer;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.timeout.ReadTimeoutHandler;
import me.internalizable.tatc.api.http.RequestHandler;
import me.internalizable.tatc.config.ServerSettings;
import me.internalizable.tatc.connection.Connection;
import me.internalizable.tatc.connection.ConnectionManager;
import me.internalizable.tatc.trust.HeaderTrustResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sets up the pipeline of every accepted connection.
 *
 * <p>Pipeline: {@code ReadTimeoutHandler -> HttpServerCodec -> HttpObjectAggregator -> RequestDispatchHandler}.
 * Connections over the configured limit are closed before any byte is read. The read timeout
 * closes a connection that goes quiet before a complete request has arrived; the dispatcher
 * removes it once the request is handed to the application.</p>
 */
public class FrontendChannelInitializer extends ChannelInitializer<SocketChannel> {

    private static final Logger LOGGER = LoggerFactory.getLogger(FrontendChannelInitializer.class);

    /**
     * Pipeline name of the read timeout guarding the request head and body.
     */
    public static final String READ_TIMEOUT = "readTimeout";

    private final ServerSettings settings;
    private final ConnectionManager connectionManager;
    private final HeaderTrustResolver resolver;
    private final RequestHandler handler;
    private final ExecutorService handlerExecutor;

    public FrontendChannelInitializer(@Nonnull ServerSettings settings,
                                      @Nonnull ConnectionManager connectionManager,
                                      @Nonnull HeaderTrustResolver resolver,
                                      @Nonnull RequestHandler handler,
                                      @Nonnull ExecutorService handlerExecutor) {
        this.settings = settings;
        this.connectionManager = connectionManager;
        this.resolver = resolver;
        this.handler = handler;
        this.handlerExecutor = handlerExecutor;
    }

    @Override
    protected void initChannel(SocketChannel ch) {
        Connection connection = connectionManager.tryRegister(ch, settings.maxConnections());
        if (connection == null) {
            LOGGER.warn("Max connections reached, rejecting connection from {}", ch.remoteAddress());
            ch.close();
            return;
        }
        LOGGER.debug("Connection {}: accepted from {}", connection.getConnectionId(), connection.getRemoteAddress());

        ch.pipeline().addLast(READ_TIMEOUT,
                new ReadTimeoutHandler(settings.requestTimeout().toMillis(), TimeUnit.MILLISECONDS));
        ch.pipeline().addLast("codec", new HttpServerCodec());
        ch.pipeline().addLast("aggregator", new HttpObjectAggregator(settings.maxContentLength()));
        ch.pipeline().addLast("dispatch", new RequestDispatchHandler(
                connectionManager,
                resolver,
                settings.trustConfig(),
                handler,
                handlerExecutor,
                settings.requestTimeout()));
    }
}

package me.internalizable.tatc.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import me.internalizable.tatc.api.http.RequestHandler;
import me.internalizable.tatc.config.ServerSettings;
import me.internalizable.tatc.connection.ConnectionManager;
import me.internalizable.tatc.pipeline.FrontendChannelInitializer;
import me.internalizable.tatc.trust.HeaderTrustResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The listening front end.
 *
 * <p>Binds a plaintext HTTP socket, accepts connections and hands every request, after the
 * forwarding headers have been resolved, to the application {@link RequestHandler}.</p>
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>One acceptor thread runs the accept loop</li>
 *   <li>Worker event loops do socket I/O and HTTP decoding</li>
 *   <li>The handler pool runs application code, so a slow handler never holds up an event loop</li>
 * </ul>
 *
 * <p>Connections share nothing but the read-only {@link ServerSettings}. An I/O error or timeout
 * closes only the connection it happened on.</p>
 *
 * @see FrontendState
 */
public class FrontendServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(FrontendServer.class);

    private final ServerSettings settings;
    private final RequestHandler handler;
    private final ConnectionManager connectionManager;
    private final HeaderTrustResolver resolver;
    private final AtomicReference<FrontendState> state = new AtomicReference<>(FrontendState.UNBOUND);
    private final CountDownLatch closed = new CountDownLatch(1);

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ExecutorService handlerExecutor;
    private volatile Channel serverChannel;

    public FrontendServer(@Nonnull ServerSettings settings, @Nonnull RequestHandler handler) {
        this.settings = settings;
        this.handler = handler;
        this.connectionManager = new ConnectionManager();
        this.resolver = new HeaderTrustResolver();
    }

    /**
     * Binds the socket and starts accepting connections.
     *
     * @throws FrontendStartupException if the socket cannot be bound
     * @throws IllegalStateException if the server was already started
     */
    public void start() throws FrontendStartupException {
        if (state.get() != FrontendState.UNBOUND) {
            throw new IllegalStateException("Front end cannot be started from state " + state.get());
        }

        LOGGER.info("Starting front end...");
        LOGGER.info("Bind address: {}:{}", settings.bindAddress(), settings.port());
        LOGGER.info("Proxy headers: {}", settings.trustConfig());

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerExecutor = newHandlerExecutor(settings.handlerThreads());

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .option(ChannelOption.SO_BACKLOG, 128)
            // bind first, accept once the bind is confirmed
            .option(ChannelOption.AUTO_READ, false)
            .childHandler(new FrontendChannelInitializer(
                settings, connectionManager, resolver, handler, handlerExecutor));

        InetSocketAddress bindAddress = new InetSocketAddress(settings.bindAddress(), settings.port());
        try {
            serverChannel = bootstrap.bind(bindAddress).sync().channel();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            state.set(FrontendState.CLOSED);
            releaseResources(false);
            closed.countDown();
            throw new FrontendStartupException("Failed to bind " + bindAddress + ": " + e.getMessage(), e);
        }
        transition(FrontendState.UNBOUND, FrontendState.BOUND);
        LOGGER.debug("Bound to {}", serverChannel.localAddress());

        serverChannel.config().setAutoRead(true);
        transition(FrontendState.BOUND, FrontendState.ACCEPTING);
        LOGGER.info("Front end started on {}", serverChannel.localAddress());
    }

    private void transition(FrontendState from, FrontendState to) {
        if (!state.compareAndSet(from, to)) {
            throw new IllegalStateException("Expected state " + from + " but was " + state.get());
        }
    }

    /**
     * Stops the server.
     *
     * <p>New connections are refused first. In-flight requests then get up to
     * {@code gracePeriod} to finish, after which remaining connections are closed.</p>
     *
     * @return {@code true} if every in-flight request finished within the grace period
     */
    public boolean stop(@Nonnull Duration gracePeriod) {
        FrontendState previous = state.getAndSet(FrontendState.CLOSED);
        if (previous == FrontendState.CLOSED) {
            return true;
        }
        if (previous == FrontendState.UNBOUND) {
            closed.countDown();
            return true;
        }

        LOGGER.info("Stopping front end...");

        // Refuse new connections
        Channel channel = serverChannel;
        if (channel != null) {
            channel.config().setAutoRead(false);
            channel.close().syncUninterruptibly();
        }

        int inFlight = connectionManager.getInFlightCount();
        if (inFlight > 0) {
            LOGGER.info("Waiting up to {} ms for {} in-flight request(s)", gracePeriod.toMillis(), inFlight);
        }

        boolean drained;
        try {
            drained = connectionManager.awaitIdle(gracePeriod.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            drained = false;
        }
        if (!drained) {
            LOGGER.warn("Grace period elapsed with {} request(s) in flight, closing their connections",
                connectionManager.getInFlightCount());
        }

        releaseResources(!drained);
        closed.countDown();
        LOGGER.info("Front end stopped");
        return drained;
    }

    private void releaseResources(boolean interruptHandlers) {
        if (handlerExecutor != null) {
            if (interruptHandlers) {
                handlerExecutor.shutdownNow();
            } else {
                handlerExecutor.shutdown();
            }
        }

        connectionManager.closeAll();

        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }

        if (handlerExecutor != null) {
            try {
                if (!handlerExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                    LOGGER.warn("Handler threads did not terminate in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Blocks until the server has stopped.
     */
    public void awaitClosed() throws InterruptedException {
        closed.await();
    }

    @Nonnull
    public FrontendState getState() {
        return state.get();
    }

    public boolean isAccepting() {
        return state.get() == FrontendState.ACCEPTING;
    }

    /**
     * @return the port actually bound, which differs from the configured one when that was {@code 0}
     * @throws IllegalStateException if the server is not bound
     */
    public int getPort() {
        Channel channel = serverChannel;
        if (channel == null || !(channel.localAddress() instanceof InetSocketAddress address)) {
            throw new IllegalStateException("Front end is not bound");
        }
        return address.getPort();
    }

    @Nonnull
    public ServerSettings getSettings() {
        return settings;
    }

    @Nonnull
    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    private static ExecutorService newHandlerExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "tatc-handler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}

package me.internalizable.tatc.lifecycle;

import me.internalizable.tatc.api.http.RequestHandler;
import me.internalizable.tatc.config.ServerSettings;
import me.internalizable.tatc.server.FrontendServer;
import me.internalizable.tatc.server.FrontendStartupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.PrintStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntConsumer;

/**
 * Runs the front end as the single long-lived process of the container.
 *
 * <p>{@link #run()} starts the server and blocks until shutdown. A termination signal (SIGTERM or
 * SIGINT, delivered through a JVM shutdown hook) drains in-flight requests for the configured grace
 * period and then ends the process with status {@code 0}, even if the grace period ran out.</p>
 *
 * <p>Exit statuses:</p>
 * <ul>
 *   <li>{@code 0} - clean shutdown</li>
 *   <li>{@code 1} - the server could not start, e.g. the port is taken</li>
 * </ul>
 */
public class ProcessLifecycleManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessLifecycleManager.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_STARTUP_FAILURE = 1;

    private final ServerSettings settings;
    private final FrontendServer server;
    private final PrintStream errorOutput;
    private final IntConsumer terminator;
    private final boolean installShutdownHook;

    private final AtomicBoolean shutdownRequested = new AtomicBoolean();
    private final CountDownLatch stopped = new CountDownLatch(1);

    /**
     * Creates a manager for a real process: a shutdown hook is installed and a signal halts the JVM
     * with status {@code 0} once the server has stopped.
     */
    public ProcessLifecycleManager(@Nonnull ServerSettings settings, @Nonnull RequestHandler handler) {
        this(settings, handler, System.err, status -> Runtime.getRuntime().halt(status), true);
    }

    /**
     * @param terminator called from the shutdown hook with the final exit status
     * @param installShutdownHook whether to react to JVM termination signals
     */
    public ProcessLifecycleManager(@Nonnull ServerSettings settings, @Nonnull RequestHandler handler,
                                   @Nonnull PrintStream errorOutput, @Nonnull IntConsumer terminator,
                                   boolean installShutdownHook) {
        this.settings = settings;
        this.server = new FrontendServer(settings, handler);
        this.errorOutput = errorOutput;
        this.terminator = terminator;
        this.installShutdownHook = installShutdownHook;
    }

    /**
     * Starts the front end and blocks until it has been shut down.
     *
     * @return the process exit status
     */
    public int run() {
        try {
            server.start();
        } catch (FrontendStartupException e) {
            LOGGER.error("Front end failed to start", e);
            errorOutput.println("ERROR: " + e.getMessage());
            stopped.countDown();
            return EXIT_STARTUP_FAILURE;
        }

        if (installShutdownHook) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::onSignal, "tatc-shutdown"));
        }

        LOGGER.info("Listening on port {}, press Ctrl+C to stop", server.getPort());

        try {
            server.awaitClosed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.info("Interrupted, shutting down");
            shutdown();
        }
        return EXIT_OK;
    }

    private void onSignal() {
        LOGGER.info("Termination signal received, shutting down");
        shutdown();
        // a signal would otherwise end the JVM with 128 + signal number
        terminator.accept(EXIT_OK);
    }

    /**
     * Stops accepting connections, waits up to the grace period for in-flight requests, then closes
     * what is left. Only the first call does anything; later calls wait for it to finish.
     */
    public void shutdown() {
        if (!shutdownRequested.compareAndSet(false, true)) {
            awaitStopped();
            return;
        }
        try {
            boolean drained = server.stop(settings.shutdownGracePeriod());
            if (!drained) {
                LOGGER.warn("Forced shutdown after {} s grace period", settings.shutdownGracePeriod().toSeconds());
            }
        } finally {
            stopped.countDown();
        }
    }

    private void awaitStopped() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Nonnull
    public FrontendServer getServer() {
        return server;
    }
}

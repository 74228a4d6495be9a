package me.internalizable.tatc.connection;

import io.netty.channel.Channel;
import io.netty.util.AttributeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks open connections and the requests in flight on them.
 *
 * <p>The front end consults it to enforce the connection limit and to drain in-flight requests on
 * shutdown.</p>
 */
public class ConnectionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

    /**
     * Channel attribute holding the {@link Connection} of an accepted channel.
     */
    public static final AttributeKey<Connection> CONNECTION = AttributeKey.valueOf("TATC_CONNECTION");

    private final Map<Long, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicInteger slots = new AtomicInteger();
    private final Object inFlightLock = new Object();
    private int inFlight;

    /**
     * Creates and registers the connection for a newly accepted channel.
     */
    @Nonnull
    public Connection register(@Nonnull Channel channel) {
        slots.incrementAndGet();
        return track(channel);
    }

    /**
     * Registers the channel only if fewer than {@code maxConnections} connections hold a slot.
     *
     * <p>The slot is taken atomically and released when the channel closes, so concurrent accepts
     * cannot overshoot the limit.</p>
     *
     * @return the new connection, or {@code null} if the limit is reached
     */
    @Nullable
    public Connection tryRegister(@Nonnull Channel channel, int maxConnections) {
        int current;
        do {
            current = slots.get();
            if (current >= maxConnections) {
                return null;
            }
        } while (!slots.compareAndSet(current, current + 1));
        return track(channel);
    }

    private Connection track(Channel channel) {
        Connection connection = new Connection(channel);
        channel.attr(CONNECTION).set(connection);
        connections.put(connection.getConnectionId(), connection);
        channel.closeFuture().addListener(future -> unregister(connection));
        return connection;
    }

    @Nullable
    public Connection getConnection(@Nonnull Channel channel) {
        return channel.attr(CONNECTION).get();
    }

    public int getConnectionCount() {
        return connections.size();
    }

    @Nonnull
    public Collection<Connection> getConnections() {
        return Collections.unmodifiableCollection(connections.values());
    }

    private void unregister(Connection connection) {
        connection.close();
        if (connections.remove(connection.getConnectionId()) != null) {
            slots.decrementAndGet();
        }
    }

    // ==================== In-flight requests ====================

    public void requestStarted() {
        synchronized (inFlightLock) {
            inFlight++;
        }
    }

    public void requestFinished() {
        synchronized (inFlightLock) {
            if (inFlight > 0) {
                inFlight--;
            }
            if (inFlight == 0) {
                inFlightLock.notifyAll();
            }
        }
    }

    public int getInFlightCount() {
        synchronized (inFlightLock) {
            return inFlight;
        }
    }

    /**
     * Blocks until no request is in flight or the timeout elapses.
     *
     * @return {@code true} if all requests finished in time
     */
    public boolean awaitIdle(long timeout, @Nonnull TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (inFlightLock) {
            while (inFlight > 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(inFlightLock, remaining);
            }
            return true;
        }
    }

    /**
     * Closes every open connection.
     */
    public void closeAll() {
        List<Connection> open = new ArrayList<>(connections.values());
        if (!open.isEmpty()) {
            LOGGER.info("Closing {} open connection(s)", open.size());
        }
        for (Connection connection : open) {
            connection.close();
        }
    }
}

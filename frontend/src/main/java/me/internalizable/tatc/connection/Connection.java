package me.internalizable.tatc.connection;

import io.netty.channel.Channel;
import me.internalizable.tatc.api.http.Scheme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One accepted transport connection.
 *
 * <p>A connection is owned by the front end for its whole life and is never handed to another
 * connection's work. It is plaintext, so its transport scheme is always {@link Scheme#HTTP}.</p>
 */
public class Connection {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);
    private static final AtomicLong CONNECTION_ID_GENERATOR = new AtomicLong(0);
    private static final InetSocketAddress UNKNOWN_ADDRESS = new InetSocketAddress("0.0.0.0", 0);

    private final long connectionId;
    @Nullable
    private final Channel channel;
    private final InetSocketAddress remoteAddress;
    private final InetSocketAddress localAddress;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.OPEN);

    public Connection(@Nonnull Channel channel) {
        this(channel, toInet(channel.remoteAddress()), toInet(channel.localAddress()));
    }

    /**
     * Creates a connection that is not backed by a channel, for resolving requests offline.
     */
    public Connection(@Nonnull InetSocketAddress remoteAddress, @Nonnull InetSocketAddress localAddress) {
        this(null, remoteAddress, localAddress);
    }

    private Connection(@Nullable Channel channel, InetSocketAddress remoteAddress, InetSocketAddress localAddress) {
        this.connectionId = CONNECTION_ID_GENERATOR.incrementAndGet();
        this.channel = channel;
        this.remoteAddress = remoteAddress;
        this.localAddress = localAddress;
    }

    private static InetSocketAddress toInet(@Nullable SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            return inet;
        }
        return UNKNOWN_ADDRESS;
    }

    public long getConnectionId() {
        return connectionId;
    }

    @Nonnull
    public InetSocketAddress getRemoteAddress() {
        return remoteAddress;
    }

    @Nonnull
    public InetSocketAddress getLocalAddress() {
        return localAddress;
    }

    @Nonnull
    public Scheme getTransportScheme() {
        return Scheme.HTTP;
    }

    @Nullable
    public Channel getChannel() {
        return channel;
    }

    @Nonnull
    public ConnectionState getState() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    /**
     * Marks the connection closed and closes the channel. Safe to call more than once.
     *
     * @return {@code true} if this call closed the connection
     */
    public boolean close() {
        if (!state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSED)) {
            return false;
        }
        if (channel != null && channel.isOpen()) {
            channel.close();
        }
        LOGGER.debug("Connection {}: closed ({})", connectionId, remoteAddress);
        return true;
    }

    @Override
    public String toString() {
        return "Connection{" +
                "id=" + connectionId +
                ", remote=" + remoteAddress +
                ", state=" + state.get() +
                '}';
    }
}

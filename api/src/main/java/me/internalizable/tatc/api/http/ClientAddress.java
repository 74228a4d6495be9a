package me.internalizable.tatc.api.http;

import javax.annotation.Nonnull;
import java.net.InetSocketAddress;

/**
 * The address a request is attributed to.
 *
 * <p>When the address comes from a forwarding header the port is whatever the proxy reported,
 * or {@code 0} when it reported none.</p>
 *
 * @param host the textual IP address, without brackets for IPv6
 * @param port the client port, {@code 0} when unknown
 */
public record ClientAddress(@Nonnull String host, int port) {

    public ClientAddress {
        if (host == null || host.isEmpty()) {
            throw new IllegalArgumentException("host must not be null or empty");
        }
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * Creates a client address from a transport socket address.
     */
    @Nonnull
    public static ClientAddress of(@Nonnull InetSocketAddress address) {
        String host = address.getAddress() != null
                ? address.getAddress().getHostAddress()
                : address.getHostString();
        return new ClientAddress(host, address.getPort());
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}

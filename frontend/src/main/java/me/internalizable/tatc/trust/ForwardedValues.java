package me.internalizable.tatc.trust;

import io.netty.util.NetUtil;
import me.internalizable.tatc.api.http.ClientAddress;
import me.internalizable.tatc.api.http.RequestHeaders;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;

/**
 * Parsing helpers for {@code X-Forwarded-*} style header values. Nothing here throws on bad
 * input; unusable values come back as {@code null}.
 */
final class ForwardedValues {

    private ForwardedValues() {
    }

    /**
     * Returns the left-most list entry across every occurrence of {@code name}, trimmed.
     *
     * <p>Repeated header lines form one list in arrival order, so the first non-blank line wins.</p>
     */
    @Nullable
    static String firstEntry(@Nonnull RequestHeaders headers, @Nonnull String name) {
        List<String> values = headers.getAll(name);
        for (String value : values) {
            if (value == null || value.isBlank()) {
                continue;
            }
            int comma = value.indexOf(',');
            String first = (comma >= 0 ? value.substring(0, comma) : value).trim();
            return first.isEmpty() ? null : first;
        }
        return null;
    }

    /**
     * Parses a forwarded-for entry into an address.
     *
     * <p>Accepted forms: {@code 203.0.113.5}, {@code 203.0.113.5:4711}, {@code 2001:db8::1},
     * {@code [2001:db8::1]} and {@code [2001:db8::1]:4711}.</p>
     */
    @Nullable
    static ClientAddress parseAddress(@Nullable String entry) {
        if (entry == null || entry.isEmpty()) {
            return null;
        }

        if (entry.charAt(0) == '[') {
            int close = entry.indexOf(']');
            if (close < 0) {
                return null;
            }
            String host = entry.substring(1, close);
            if (!NetUtil.isValidIpV6Address(host)) {
                return null;
            }
            String rest = entry.substring(close + 1);
            if (rest.isEmpty()) {
                return new ClientAddress(normalizeIpv6(host), 0);
            }
            if (rest.charAt(0) != ':') {
                return null;
            }
            int port = parsePort(rest.substring(1));
            return port < 0 ? null : new ClientAddress(normalizeIpv6(host), port);
        }

        if (NetUtil.isValidIpV4Address(entry)) {
            return new ClientAddress(entry, 0);
        }
        if (NetUtil.isValidIpV6Address(entry)) {
            return new ClientAddress(normalizeIpv6(entry), 0);
        }

        // IPv4 with a port; an unbracketed IPv6 literal never gets here with a single colon
        int colon = entry.indexOf(':');
        if (colon > 0 && colon == entry.lastIndexOf(':')) {
            String host = entry.substring(0, colon);
            int port = parsePort(entry.substring(colon + 1));
            if (port >= 0 && NetUtil.isValidIpV4Address(host)) {
                return new ClientAddress(host, port);
            }
        }
        return null;
    }

    /**
     * @return whether {@code proto} names the secure scheme
     */
    static boolean isHttps(@Nullable String proto) {
        return proto != null && proto.equalsIgnoreCase("https");
    }

    /**
     * Accepts a forwarded host authority if it contains no whitespace or control characters.
     */
    @Nullable
    static String parseHost(@Nullable String entry) {
        if (entry == null || entry.isEmpty()) {
            return null;
        }
        for (int i = 0; i < entry.length(); i++) {
            char c = entry.charAt(i);
            if (c <= ' ' || c == 0x7F) {
                return null;
            }
        }
        return entry;
    }

    private static int parsePort(String text) {
        if (text.isEmpty() || text.length() > 5) {
            return -1;
        }
        int port = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
            port = port * 10 + (c - '0');
        }
        return port <= 0xFFFF ? port : -1;
    }

    private static String normalizeIpv6(String host) {
        byte[] bytes = NetUtil.createByteArrayFromIpAddressString(host);
        return bytes != null ? NetUtil.bytesToIpAddress(bytes) : host;
    }
}

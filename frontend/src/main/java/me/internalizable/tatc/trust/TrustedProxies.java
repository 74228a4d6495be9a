package me.internalizable.tatc.trust;

import io.netty.util.NetUtil;
import me.internalizable.tatc.config.ConfigurationException;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The set of peers allowed to supply forwarding headers.
 *
 * <p>Entries are IP literals ({@code 10.0.0.1}, {@code ::1}), CIDR blocks ({@code 10.0.0.0/8},
 * {@code fd00::/8}) or {@code *} for any peer. IPv4-mapped IPv6 peers are matched against IPv4
 * entries.</p>
 */
public final class TrustedProxies {

    public static final String ANY = "*";

    private static final TrustedProxies ANY_PEER = new TrustedProxies(true, List.of(), Set.of(ANY));

    private final boolean any;
    private final List<Block> blocks;
    private final Set<String> entries;

    private TrustedProxies(boolean any, List<Block> blocks, Set<String> entries) {
        this.any = any;
        this.blocks = blocks;
        this.entries = entries;
    }

    @Nonnull
    public static TrustedProxies any() {
        return ANY_PEER;
    }

    /**
     * Parses the given entries.
     *
     * @throws ConfigurationException if an entry is neither an IP literal, a CIDR block nor {@code *}
     */
    @Nonnull
    public static TrustedProxies parse(@Nonnull Collection<String> rawEntries) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String raw : rawEntries) {
            if (raw == null) {
                continue;
            }
            String entry = raw.trim();
            if (!entry.isEmpty()) {
                normalized.add(entry);
            }
        }
        if (normalized.isEmpty()) {
            throw new ConfigurationException("trusted proxy list must not be empty (use \"*\" to trust any peer)");
        }
        if (normalized.contains(ANY)) {
            return ANY_PEER;
        }

        List<Block> blocks = new ArrayList<>(normalized.size());
        for (String entry : normalized) {
            blocks.add(Block.parse(entry));
        }
        return new TrustedProxies(false, List.copyOf(blocks), Collections.unmodifiableSet(normalized));
    }

    /**
     * Parses a comma separated list such as {@code "10.0.0.0/8, 127.0.0.1"}.
     */
    @Nonnull
    public static TrustedProxies parse(@Nonnull String commaSeparated) {
        return parse(List.of(commaSeparated.split(",")));
    }

    public boolean trustsAny() {
        return any;
    }

    /**
     * @return whether forwarding headers from {@code peer} may be believed
     */
    public boolean isTrusted(@Nullable InetSocketAddress peer) {
        if (any) {
            return true;
        }
        if (peer == null || peer.getAddress() == null) {
            return false;
        }
        return isTrusted(peer.getAddress());
    }

    public boolean isTrusted(@Nonnull InetAddress address) {
        if (any) {
            return true;
        }
        byte[] bytes = unmapIpv4(address.getAddress());
        for (Block block : blocks) {
            if (block.contains(bytes)) {
                return true;
            }
        }
        return false;
    }

    @Nonnull
    public Set<String> entries() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrustedProxies other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return String.join(",", entries);
    }

    private static byte[] unmapIpv4(byte[] address) {
        if (address.length != 16) {
            return address;
        }
        for (int i = 0; i < 10; i++) {
            if (address[i] != 0) {
                return address;
            }
        }
        if ((address[10] & 0xFF) != 0xFF || (address[11] & 0xFF) != 0xFF) {
            return address;
        }
        byte[] v4 = new byte[4];
        System.arraycopy(address, 12, v4, 0, 4);
        return v4;
    }

    private record Block(byte[] network, int prefixLength) {

        static Block parse(String entry) {
            String address = entry;
            int prefixLength = -1;
            int slash = entry.indexOf('/');
            if (slash >= 0) {
                address = entry.substring(0, slash);
                try {
                    prefixLength = Integer.parseInt(entry.substring(slash + 1));
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("invalid CIDR prefix in trusted proxy entry: " + entry, e);
                }
            }

            byte[] bytes = NetUtil.createByteArrayFromIpAddressString(address);
            if (bytes == null) {
                throw new ConfigurationException("invalid trusted proxy entry: " + entry);
            }
            bytes = unmapIpv4(bytes);

            int maxPrefix = bytes.length * 8;
            if (prefixLength < 0) {
                prefixLength = maxPrefix;
            } else if (prefixLength > maxPrefix) {
                throw new ConfigurationException("CIDR prefix too long in trusted proxy entry: " + entry);
            }
            return new Block(bytes, prefixLength);
        }

        boolean contains(byte[] candidate) {
            if (candidate.length != network.length) {
                return false;
            }
            int fullBytes = prefixLength / 8;
            for (int i = 0; i < fullBytes; i++) {
                if (candidate[i] != network[i]) {
                    return false;
                }
            }
            int remainingBits = prefixLength % 8;
            if (remainingBits == 0) {
                return true;
            }
            int mask = (0xFF << (8 - remainingBits)) & 0xFF;
            return (candidate[fullBytes] & mask) == (network[fullBytes] & mask);
        }
    }
}

package me.internalizable.tatc.trust;

import me.internalizable.tatc.config.ConfigurationException;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Process-wide rules for believing forwarding headers. Immutable; built once at startup and read by
 * every request without synchronization.
 */
public final class TrustConfig {

    public static final String DEFAULT_FORWARDED_FOR = "X-Forwarded-For";
    public static final String DEFAULT_FORWARDED_PROTO = "X-Forwarded-Proto";
    public static final String DEFAULT_FORWARDED_HOST = "X-Forwarded-Host";

    private static final TrustConfig DISABLED = new TrustConfig(false,
            DEFAULT_FORWARDED_FOR, DEFAULT_FORWARDED_PROTO, DEFAULT_FORWARDED_HOST, TrustedProxies.any());

    private final boolean enabled;
    private final String forwardedForHeader;
    private final String forwardedProtoHeader;
    private final String forwardedHostHeader;
    private final TrustedProxies trustedProxies;

    private TrustConfig(boolean enabled, String forwardedForHeader, String forwardedProtoHeader,
                        String forwardedHostHeader, TrustedProxies trustedProxies) {
        this.enabled = enabled;
        this.forwardedForHeader = forwardedForHeader;
        this.forwardedProtoHeader = forwardedProtoHeader;
        this.forwardedHostHeader = forwardedHostHeader;
        this.trustedProxies = trustedProxies;
    }

    /**
     * Forwarding headers are ignored entirely.
     */
    @Nonnull
    public static TrustConfig disabled() {
        return DISABLED;
    }

    /**
     * Conventional {@code X-Forwarded-*} headers, trusted from any peer.
     */
    @Nonnull
    public static TrustConfig enabledForAnyPeer() {
        return builder().enabled(true).build();
    }

    @Nonnull
    public static Builder builder() {
        return new Builder();
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Nonnull
    public String getForwardedForHeader() {
        return forwardedForHeader;
    }

    @Nonnull
    public String getForwardedProtoHeader() {
        return forwardedProtoHeader;
    }

    @Nonnull
    public String getForwardedHostHeader() {
        return forwardedHostHeader;
    }

    @Nonnull
    public TrustedProxies getTrustedProxies() {
        return trustedProxies;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrustConfig that)) return false;
        return enabled == that.enabled
                && forwardedForHeader.equalsIgnoreCase(that.forwardedForHeader)
                && forwardedProtoHeader.equalsIgnoreCase(that.forwardedProtoHeader)
                && forwardedHostHeader.equalsIgnoreCase(that.forwardedHostHeader)
                && trustedProxies.equals(that.trustedProxies);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, trustedProxies);
    }

    @Override
    public String toString() {
        return "TrustConfig{" +
                "enabled=" + enabled +
                ", forwardedForHeader=" + forwardedForHeader +
                ", forwardedProtoHeader=" + forwardedProtoHeader +
                ", forwardedHostHeader=" + forwardedHostHeader +
                ", trustedProxies=" + trustedProxies +
                '}';
    }

    /**
     * Checks {@code name} is an RFC 9110 token, which is all a header field name may contain.
     */
    static boolean isValidHeaderName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean alphaNumeric = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
            if (!alphaNumeric && "!#$%&'*+-.^_`|~".indexOf(c) < 0) {
                return false;
            }
        }
        return true;
    }

    public static final class Builder {

        private boolean enabled;
        private String forwardedForHeader = DEFAULT_FORWARDED_FOR;
        private String forwardedProtoHeader = DEFAULT_FORWARDED_PROTO;
        private String forwardedHostHeader = DEFAULT_FORWARDED_HOST;
        private TrustedProxies trustedProxies = TrustedProxies.any();

        private Builder() {
        }

        @Nonnull
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        @Nonnull
        public Builder forwardedForHeader(@Nonnull String name) {
            this.forwardedForHeader = name;
            return this;
        }

        @Nonnull
        public Builder forwardedProtoHeader(@Nonnull String name) {
            this.forwardedProtoHeader = name;
            return this;
        }

        @Nonnull
        public Builder forwardedHostHeader(@Nonnull String name) {
            this.forwardedHostHeader = name;
            return this;
        }

        @Nonnull
        public Builder trustedProxies(@Nonnull TrustedProxies trustedProxies) {
            this.trustedProxies = Objects.requireNonNull(trustedProxies, "trustedProxies");
            return this;
        }

        /**
         * @throws ConfigurationException if a header name is not a valid HTTP field name
         */
        @Nonnull
        public TrustConfig build() {
            checkHeaderName("forwarded-for", forwardedForHeader);
            checkHeaderName("forwarded-proto", forwardedProtoHeader);
            checkHeaderName("forwarded-host", forwardedHostHeader);
            return new TrustConfig(enabled, forwardedForHeader, forwardedProtoHeader,
                    forwardedHostHeader, trustedProxies);
        }

        private static void checkHeaderName(String role, String name) {
            if (!isValidHeaderName(name)) {
                throw new ConfigurationException("invalid " + role + " header name: '" + name + "'");
            }
        }
    }
}

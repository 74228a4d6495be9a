package me.internalizable.tatc.config;

import me.internalizable.tatc.trust.TrustConfig;
import me.internalizable.tatc.trust.TrustedProxies;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for trusting {@code X-Forwarded-*} headers from a reverse proxy.
 *
 * <h2>Security</h2>
 * <p><b>WARNING:</b> Only enable proxy headers if the front end is reachable exclusively through a
 * proxy that sets them. If enabled while clients can connect directly, they can spoof their IP
 * addresses. Restrict {@link #getTrustedProxies()} where possible.</p>
 */
public class ProxyHeadersConfig {

    /**
     * Whether to believe forwarding headers at all.
     */
    private boolean enabled = true;

    /**
     * Header carrying the client address chain, left-most entry is the original client.
     */
    private String forwardedForHeader = TrustConfig.DEFAULT_FORWARDED_FOR;

    /**
     * Header carrying the scheme the client used.
     */
    private String forwardedProtoHeader = TrustConfig.DEFAULT_FORWARDED_PROTO;

    /**
     * Header carrying the host the client asked for.
     */
    private String forwardedHostHeader = TrustConfig.DEFAULT_FORWARDED_HOST;

    /**
     * Peers whose forwarding headers are believed: IP literals, CIDR blocks, or "*" for any peer.
     */
    private List<String> trustedProxies = new ArrayList<>(List.of(TrustedProxies.ANY));

    // ==================== Constructors ====================

    public ProxyHeadersConfig() {
    }

    public ProxyHeadersConfig(boolean enabled, List<String> trustedProxies) {
        this.enabled = enabled;
        setTrustedProxies(trustedProxies);
    }

    // ==================== Getters/Setters ====================

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getForwardedForHeader() {
        return forwardedForHeader;
    }

    public void setForwardedForHeader(String forwardedForHeader) {
        this.forwardedForHeader = forwardedForHeader;
    }

    public String getForwardedProtoHeader() {
        return forwardedProtoHeader;
    }

    public void setForwardedProtoHeader(String forwardedProtoHeader) {
        this.forwardedProtoHeader = forwardedProtoHeader;
    }

    public String getForwardedHostHeader() {
        return forwardedHostHeader;
    }

    public void setForwardedHostHeader(String forwardedHostHeader) {
        this.forwardedHostHeader = forwardedHostHeader;
    }

    public List<String> getTrustedProxies() {
        return trustedProxies;
    }

    public void setTrustedProxies(List<String> trustedProxies) {
        this.trustedProxies = trustedProxies != null ? new ArrayList<>(trustedProxies) : new ArrayList<>();
    }

    /**
     * Validates this configuration and freezes it.
     *
     * @throws ConfigurationException if a header name or trusted proxy entry is invalid
     */
    public TrustConfig toTrustConfig() {
        return TrustConfig.builder()
                .enabled(enabled)
                .forwardedForHeader(forwardedForHeader)
                .forwardedProtoHeader(forwardedProtoHeader)
                .forwardedHostHeader(forwardedHostHeader)
                .trustedProxies(TrustedProxies.parse(trustedProxies))
                .build();
    }

    @Override
    public String toString() {
        return "ProxyHeadersConfig{" +
                "enabled=" + enabled +
                ", forwardedForHeader=" + forwardedForHeader +
                ", forwardedProtoHeader=" + forwardedProtoHeader +
                ", forwardedHostHeader=" + forwardedHostHeader +
                ", trustedProxies=" + trustedProxies +
                '}';
    }
}

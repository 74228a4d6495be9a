/**
 * Forwarding header support for the front end.
 *
 * <p>When the front end runs behind a reverse proxy or load balancer, the transport peer is the
 * proxy, not the client. The proxy records the original client in {@code X-Forwarded-For},
 * {@code X-Forwarded-Proto} and {@code X-Forwarded-Host}; this package decides whether and how to
 * believe those headers.</p>
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link me.internalizable.tatc.trust.HeaderTrustResolver} - Builds the request context</li>
 *   <li>{@link me.internalizable.tatc.trust.TrustConfig} - Which headers to read, and whether to</li>
 *   <li>{@link me.internalizable.tatc.trust.TrustedProxies} - Which peers may send them</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>
 * proxyHeaders:
 *   enabled: true
 *   forwardedForHeader: "X-Forwarded-For"
 *   forwardedProtoHeader: "X-Forwarded-Proto"
 *   forwardedHostHeader: "X-Forwarded-Host"
 *   trustedProxies:
 *     - "10.0.0.0/8"
 *     - "127.0.0.1"
 * </pre>
 *
 * <h2>Security Considerations</h2>
 * <p><b>WARNING:</b> Only enable proxy headers when every connection reaches the front end through
 * a proxy that overwrites them. Otherwise clients can claim any address they like. Narrow
 * {@code trustedProxies} to the proxy's addresses when the network allows direct connections.</p>
 */
package me.internalizable.tatc.trust;

package me.internalizable.tatc.trust;

import io.netty.handler.codec.http.QueryStringDecoder;
import me.internalizable.tatc.api.http.ClientAddress;
import me.internalizable.tatc.api.http.RequestContext;
import me.internalizable.tatc.api.http.RequestHeaders;
import me.internalizable.tatc.api.http.Scheme;
import me.internalizable.tatc.connection.Connection;
import me.internalizable.tatc.connection.InboundRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.net.InetSocketAddress;

/**
 * Decides who a request really came from.
 *
 * <p>With trust disabled, or when the peer is not a trusted proxy, the transport address and
 * scheme are used as-is. Otherwise:</p>
 * <ul>
 *   <li><b>Address</b>: the left-most entry of the forwarded-for header, which is the originating
 *       client by convention of the forwarding chain. If that entry is not an IP literal it is
 *       discarded and the transport address is used.</li>
 *   <li><b>Scheme</b>: {@code https} if the forwarded-proto header says so, otherwise the transport
 *       scheme.</li>
 *   <li><b>Host</b>: the forwarded-host header when usable, otherwise the {@code Host} header.</li>
 * </ul>
 *
 * <p>Malformed header values never cause an error. They are treated as absent. The resolver has
 * no state and no side effects, so one instance can serve every connection.</p>
 */
public final class HeaderTrustResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(HeaderTrustResolver.class);

    private static final String HOST = "Host";

    /**
     * Resolves the request context for one request.
     *
     * @param connection the connection the request arrived on
     * @param request the request as read off the wire
     * @param trustConfig the active trust rules
     * @return the resolved context, with a non-null client address
     */
    @Nonnull
    public RequestContext resolve(@Nonnull Connection connection, @Nonnull InboundRequest request,
                                  @Nonnull TrustConfig trustConfig) {
        InetSocketAddress remote = connection.getRemoteAddress();
        RequestHeaders headers = request.headers();

        ClientAddress clientAddress = ClientAddress.of(remote);
        Scheme scheme = connection.getTransportScheme();
        String host = null;

        if (trustConfig.isEnabled()) {
            if (trustConfig.getTrustedProxies().isTrusted(remote)) {
                ClientAddress forwarded = resolveAddress(headers, trustConfig);
                if (forwarded != null) {
                    clientAddress = forwarded;
                }
                if (ForwardedValues.isHttps(ForwardedValues.firstEntry(headers, trustConfig.getForwardedProtoHeader()))) {
                    scheme = Scheme.HTTPS;
                }
                host = ForwardedValues.parseHost(ForwardedValues.firstEntry(headers, trustConfig.getForwardedHostHeader()));
            } else {
                LOGGER.debug("Connection {}: peer {} is not a trusted proxy, ignoring forwarding headers",
                        connection.getConnectionId(), remote);
            }
        }

        if (host == null) {
            host = hostHeaderOrLocal(headers, connection);
        }

        String target = request.target();
        return new RequestContext(
                connection.getConnectionId(),
                clientAddress,
                scheme,
                host,
                request.method(),
                target,
                decodePath(target),
                rawQuery(target),
                headers,
                request.body()
        );
    }

    private ClientAddress resolveAddress(RequestHeaders headers, TrustConfig trustConfig) {
        String entry = ForwardedValues.firstEntry(headers, trustConfig.getForwardedForHeader());
        if (entry == null) {
            return null;
        }
        ClientAddress address = ForwardedValues.parseAddress(entry);
        if (address == null) {
            LOGGER.debug("Discarding malformed {} entry: {}", trustConfig.getForwardedForHeader(), entry);
        }
        return address;
    }

    private static String hostHeaderOrLocal(RequestHeaders headers, Connection connection) {
        String host = ForwardedValues.parseHost(trimmed(headers.get(HOST)));
        if (host != null) {
            return host;
        }
        InetSocketAddress local = connection.getLocalAddress();
        return ClientAddress.of(local).toString();
    }

    private static String trimmed(String value) {
        return value == null ? null : value.trim();
    }

    // ==================== Target ====================

    private static String originForm(String target) {
        int schemeEnd = target.indexOf("://");
        if (schemeEnd > 0 && target.indexOf('/') > schemeEnd) {
            int pathStart = target.indexOf('/', schemeEnd + 3);
            return pathStart < 0 ? "/" : target.substring(pathStart);
        }
        return target;
    }

    private static String decodePath(String target) {
        String origin = originForm(target);
        try {
            return new QueryStringDecoder(origin).path();
        } catch (IllegalArgumentException e) {
            // bad percent-encoding; hand the path over undecoded
            int question = origin.indexOf('?');
            return question >= 0 ? origin.substring(0, question) : origin;
        }
    }

    private static String rawQuery(String target) {
        String origin = originForm(target);
        int question = origin.indexOf('?');
        if (question < 0) {
            return "";
        }
        int fragment = origin.indexOf('#', question);
        return fragment >= 0 ? origin.substring(question + 1, fragment) : origin.substring(question + 1);
    }
}

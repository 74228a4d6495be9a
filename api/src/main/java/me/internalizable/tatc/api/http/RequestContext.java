package me.internalizable.tatc.api.http;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Objects;

/**
 * Everything the application layer learns about one request, after forwarding headers have been
 * applied.
 *
 * <p>A context is created once per request and never shared between requests. It is immutable;
 * {@link #body()} returns a copy.</p>
 *
 * @param connectionId id of the connection the request arrived on
 * @param clientAddress the resolved client address, never {@code null}
 * @param scheme the resolved scheme
 * @param host the resolved host authority (forwarded host, {@code Host} header or local address)
 * @param method the request method, e.g. {@code GET}
 * @param target the raw request target as sent on the request line
 * @param path the decoded path component of {@link #target()}
 * @param query the raw query string without the leading {@code ?}, empty when absent
 * @param headers the original request headers in arrival order
 * @param body the request body, empty when absent
 */
public record RequestContext(
        long connectionId,
        @Nonnull ClientAddress clientAddress,
        @Nonnull Scheme scheme,
        @Nonnull String host,
        @Nonnull String method,
        @Nonnull String target,
        @Nonnull String path,
        @Nonnull String query,
        @Nonnull RequestHeaders headers,
        @Nonnull byte[] body
) {

    private static final byte[] NO_BODY = new byte[0];

    public RequestContext {
        Objects.requireNonNull(clientAddress, "clientAddress");
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(headers, "headers");
        body = body == null || body.length == 0 ? NO_BODY : body.clone();
    }

    @Override
    @Nonnull
    public byte[] body() {
        return body.length == 0 ? NO_BODY : body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RequestContext other)) return false;
        return connectionId == other.connectionId
                && clientAddress.equals(other.clientAddress)
                && scheme == other.scheme
                && host.equals(other.host)
                && method.equals(other.method)
                && target.equals(other.target)
                && path.equals(other.path)
                && query.equals(other.query)
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(connectionId, clientAddress, scheme, host, method, target, path, query, headers);
        return 31 * result + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "RequestContext{" +
                "connectionId=" + connectionId +
                ", clientAddress=" + clientAddress +
                ", scheme=" + scheme +
                ", host='" + host + '\'' +
                ", method='" + method + '\'' +
                ", target='" + target + '\'' +
                ", bodyLength=" + body.length +
                '}';
    }
}

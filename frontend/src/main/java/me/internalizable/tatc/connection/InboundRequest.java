package me.internalizable.tatc.connection;

import me.internalizable.tatc.api.http.RequestHeaders;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Objects;

/**
 * A request as read off the wire, before any forwarding header is interpreted.
 *
 * @param method the request method
 * @param target the raw request target
 * @param headers the headers in arrival order
 * @param body the aggregated body, empty when absent
 */
public record InboundRequest(
        @Nonnull String method,
        @Nonnull String target,
        @Nonnull RequestHeaders headers,
        @Nonnull byte[] body
) {

    public InboundRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(headers, "headers");
        body = body == null ? new byte[0] : body;
    }

    @Nonnull
    public static InboundRequest of(@Nonnull String method, @Nonnull String target, @Nonnull RequestHeaders headers) {
        return new InboundRequest(method, target, headers, new byte[0]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InboundRequest other)) return false;
        return method.equals(other.method)
                && target.equals(other.target)
                && headers.equals(other.headers)
                && Arrays.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(method, target, headers) + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        return "InboundRequest{" + method + ' ' + target + ", headers=" + headers.size() + ", body=" + body.length + '}';
    }
}

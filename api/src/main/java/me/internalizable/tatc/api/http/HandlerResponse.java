package me.internalizable.tatc.api.http;

import javax.annotation.Nonnull;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Response produced by a {@link RequestHandler}.
 *
 * <p>The front end adds {@code Content-Length} and {@code Connection: close}; handlers should not
 * set either.</p>
 *
 * @param status the HTTP status code, 100-599
 * @param headers response headers in the order they should be written
 * @param body the response body
 */
public record HandlerResponse(int status, @Nonnull List<Map.Entry<String, String>> headers, @Nonnull byte[] body) {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String TEXT_PLAIN = "text/plain; charset=utf-8";
    public static final String APPLICATION_JSON = "application/json";

    public HandlerResponse {
        if (status < 100 || status > 599) {
            throw new IllegalArgumentException("status out of range: " + status);
        }
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(body, "body");
        headers = Collections.unmodifiableList(new ArrayList<>(headers));
        body = body.clone();
    }

    @Override
    @Nonnull
    public byte[] body() {
        return body.clone();
    }

    /**
     * Creates a {@code text/plain} response.
     */
    @Nonnull
    public static HandlerResponse text(int status, @Nonnull String text) {
        return new HandlerResponse(status,
                List.of(Map.entry(CONTENT_TYPE, TEXT_PLAIN)),
                text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates an {@code application/json} response from an already serialized document.
     */
    @Nonnull
    public static HandlerResponse json(int status, @Nonnull String json) {
        return new HandlerResponse(status,
                List.of(Map.entry(CONTENT_TYPE, APPLICATION_JSON)),
                json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Creates a response without a body.
     */
    @Nonnull
    public static HandlerResponse empty(int status) {
        return new HandlerResponse(status, List.of(), new byte[0]);
    }

    @Override
    public String toString() {
        return "HandlerResponse{status=" + status + ", headers=" + headers + ", bodyLength=" + body.length + '}';
    }
}

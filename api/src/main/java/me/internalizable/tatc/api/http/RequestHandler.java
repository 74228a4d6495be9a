package me.internalizable.tatc.api.http;

import javax.annotation.Nonnull;

/**
 * The application layer behind the front end.
 *
 * <p>Handlers are invoked on a worker pool, never on a network thread, so they may block. Any
 * exception thrown is reported to the client as {@code 500 Internal Server Error} and affects only
 * the request that caused it.</p>
 *
 * <p>Implementations can be installed through {@link java.util.ServiceLoader} by listing them in
 * {@code META-INF/services/me.internalizable.tatc.api.http.RequestHandler}.</p>
 */
@FunctionalInterface
public interface RequestHandler {

    /**
     * Handles one request.
     *
     * @param context the resolved request
     * @return the response to send, must not be {@code null}
     * @throws Exception if the request could not be handled
     */
    @Nonnull
    HandlerResponse handle(@Nonnull RequestContext context) throws Exception;
}

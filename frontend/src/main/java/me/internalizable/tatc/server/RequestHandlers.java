package me.internalizable.tatc.server;

import me.internalizable.tatc.api.http.HandlerResponse;
import me.internalizable.tatc.api.http.RequestHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Locates the application handler.
 */
public final class RequestHandlers {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestHandlers.class);

    static final String NOT_FOUND_BODY = "{\"detail\":\"Not Found\"}";

    private static final RequestHandler NOT_FOUND = context -> HandlerResponse.json(404, NOT_FOUND_BODY);

    private RequestHandlers() {
    }

    /**
     * The handler used when no application is installed; answers every request with {@code 404}.
     */
    @Nonnull
    public static RequestHandler notFound() {
        return NOT_FOUND;
    }

    /**
     * Returns the first {@link RequestHandler} registered with {@link ServiceLoader}, or
     * {@link #notFound()} if there is none.
     *
     * @throws ServiceConfigurationError if a registered provider cannot be instantiated
     */
    @Nonnull
    public static RequestHandler discover(@Nonnull ClassLoader classLoader) {
        Iterator<RequestHandler> providers = ServiceLoader.load(RequestHandler.class, classLoader).iterator();
        if (!providers.hasNext()) {
            LOGGER.warn("No application handler installed, every request will be answered with 404");
            return NOT_FOUND;
        }

        RequestHandler handler = providers.next();
        LOGGER.info("Using application handler {}", handler.getClass().getName());
        if (providers.hasNext()) {
            LOGGER.warn("More than one application handler installed, ignoring all but {}",
                    handler.getClass().getName());
        }
        return handler;
    }
}

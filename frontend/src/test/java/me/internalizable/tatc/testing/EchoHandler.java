package me.internalizable.tatc.testing;

import java.nio.charset.StandardCharsets;

import me.internalizable.tatc.api.http.HandlerResponse;
import me.internalizable.tatc.api.http.RequestContext;
import me.internalizable.tatc.api.http.RequestHandler;

/**
 * Answers with what the front end resolved, as {@code client|scheme|host|path|body}.
 *
 * <p>{@code /sleep?ms=N} sleeps before answering, {@code /fail} throws.</p>
 */
public class EchoHandler implements RequestHandler {

    @Override
    public HandlerResponse handle(RequestContext context) throws Exception {
        if (context.path().equals("/fail")) {
            throw new IllegalStateException("handler failure");
        }
        if (context.path().equals("/sleep")) {
            Thread.sleep(Long.parseLong(context.query().substring("ms=".length())));
        }
        return HandlerResponse.text(200, String.join("|",
                context.clientAddress().host(),
                context.scheme().value(),
                context.host(),
                context.path(),
                new String(context.body(), StandardCharsets.UTF_8)));
    }
}

package me.internalizable.tatc.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderResult;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.timeout.ReadTimeoutHandler;
import me.internalizable.tatc.api.http.HandlerResponse;
import me.internalizable.tatc.api.http.RequestHandler;
import me.internalizable.tatc.connection.ConnectionManager;
import me.internalizable.tatc.trust.HeaderTrustResolver;
import me.internalizable.tatc.trust.TrustConfig;
import me.internalizable.tatc.testing.EchoHandler;

@DisplayName("RequestDispatchHandler")
class RequestDispatchHandlerTest {

    private ConnectionManager connectionManager;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        connectionManager = new ConnectionManager();
        channel = new EmbeddedChannel();
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private void install(RequestHandler handler, ExecutorService executor) {
        connectionManager.register(channel);
        channel.pipeline().addLast(new RequestDispatchHandler(
            connectionManager,
            new HeaderTrustResolver(),
            TrustConfig.enabledForAnyPeer(),
            handler,
            executor,
            Duration.ofSeconds(5)));
    }

    private static FullHttpRequest request(String uri, String... headerPairs) {
        var request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
        for (int i = 0; i < headerPairs.length; i += 2) {
            request.headers().add(headerPairs[i], headerPairs[i + 1]);
        }
        return request;
    }

    private FullHttpResponse exchange(FullHttpRequest request) {
        channel.writeInbound(request);
        channel.runPendingTasks();
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "no response written");
        return response;
    }

    private static String body(FullHttpResponse response) {
        try {
            return response.content().toString(StandardCharsets.UTF_8);
        } finally {
            response.release();
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class DispatchTests {

        @Test
        @DisplayName("Should pass the resolved context to the handler")
        void shouldPassResolvedContext() {
            install(new EchoHandler(), new DirectExecutorService());

            var response = exchange(request("/echo?x=1",
                "Host", "backend.internal",
                "X-Forwarded-For", "203.0.113.5, 10.0.0.1",
                "X-Forwarded-Proto", "https"));

            assertEquals(200, response.status().code());
            assertEquals("203.0.113.5|https|backend.internal|/echo|", body(response));
        }

        @Test
        @DisplayName("Should close the connection after every response")
        void shouldCloseAfterResponse() {
            install(new EchoHandler(), new DirectExecutorService());

            var response = exchange(request("/"));

            assertEquals("close", response.headers().get(HttpHeaderNames.CONNECTION));
            assertEquals(response.content().readableBytes(),
                response.headers().getInt(HttpHeaderNames.CONTENT_LENGTH).intValue());
            response.release();
            assertFalse(channel.isOpen());
        }

        @Test
        @DisplayName("Should copy the request body out of the buffer")
        void shouldCopyBody() {
            install(new EchoHandler(), new DirectExecutorService());
            var request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/submit",
                Unpooled.copiedBuffer("payload", StandardCharsets.UTF_8));

            var response = exchange(request);

            assertEquals("0.0.0.0|http|0.0.0.0:0|/submit|payload", body(response));
        }

        @Test
        @DisplayName("Should release the in-flight count once answered")
        void shouldReleaseInFlight() {
            install(new EchoHandler(), new DirectExecutorService());

            exchange(request("/")).release();

            assertEquals(0, connectionManager.getInFlightCount());
        }

        @Test
        @DisplayName("Should lift the read timeout before the handler runs")
        void shouldRemoveReadTimeout() {
            channel.pipeline().addLast(FrontendChannelInitializer.READ_TIMEOUT,
                new ReadTimeoutHandler(5, TimeUnit.SECONDS));
            var guarded = new AtomicBoolean(true);
            install(context -> {
                guarded.set(channel.pipeline().get(FrontendChannelInitializer.READ_TIMEOUT) != null);
                return HandlerResponse.empty(204);
            }, new DirectExecutorService());

            exchange(request("/")).release();

            assertFalse(guarded.get());
        }

        @Test
        @DisplayName("Should serve only the first of two requests arriving in one read")
        void shouldDropPipelinedRequest() {
            var calls = new AtomicInteger();
            install(context -> {
                calls.incrementAndGet();
                return HandlerResponse.text(200, context.target());
            }, new DirectExecutorService());

            channel.writeInbound(request("/first"), request("/second"));
            channel.runPendingTasks();

            FullHttpResponse response = channel.readOutbound();
            assertNotNull(response);
            assertEquals("/first", body(response));
            assertNull(channel.readOutbound());
            assertEquals(1, calls.get());
            assertEquals(0, connectionManager.getInFlightCount());
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should answer 500 when the handler throws")
        void shouldAnswer500OnException() {
            install(new EchoHandler(), new DirectExecutorService());

            var response = exchange(request("/fail"));

            assertEquals(500, response.status().code());
            assertEquals("close", response.headers().get(HttpHeaderNames.CONNECTION));
            response.release();
            assertEquals(0, connectionManager.getInFlightCount());
        }

        @Test
        @DisplayName("Should answer 500 when the handler returns nothing")
        void shouldAnswer500OnNull() {
            install(context -> null, new DirectExecutorService());

            var response = exchange(request("/"));

            assertEquals(500, response.status().code());
            response.release();
        }

        @Test
        @DisplayName("Should answer 500 when a response header value carries a line break")
        void shouldAnswer500OnUnencodableHeader() {
            install(context -> new HandlerResponse(200, List.of(Map.entry("X-Bad", "a\r\nb")), new byte[0]),
                new DirectExecutorService());

            var response = exchange(request("/"));

            assertEquals(500, response.status().code());
            assertEquals("close", response.headers().get(HttpHeaderNames.CONNECTION));
            assertNull(response.headers().get("X-Bad"));
            response.release();
            assertEquals(0, connectionManager.getInFlightCount());
            assertFalse(channel.isOpen());
        }

        @Test
        @DisplayName("Should answer 500 when a response header has no value")
        void shouldAnswer500OnNullHeaderValue() {
            Map.Entry<String, String> missing = new AbstractMap.SimpleEntry<>("X-Missing", null);
            install(context -> new HandlerResponse(200, List.of(missing), new byte[0]), new DirectExecutorService());

            var response = exchange(request("/"));

            assertEquals(500, response.status().code());
            assertTrue(body(response).contains("Internal Server Error"));
            assertEquals(0, connectionManager.getInFlightCount());
        }

        @Test
        @DisplayName("Should answer 400 for a malformed request without calling the handler")
        void shouldAnswer400OnDecoderFailure() {
            install(context -> {
                throw new AssertionError("handler must not run");
            }, new DirectExecutorService());
            var request = request("/");
            request.setDecoderResult(DecoderResult.failure(new IllegalArgumentException("invalid header")));

            var response = exchange(request);

            assertEquals(400, response.status().code());
            response.release();
        }

        @Test
        @DisplayName("Should answer 503 once the handler pool is shut down")
        void shouldAnswer503WhenRejected() {
            var executor = new DirectExecutorService();
            executor.shutdown();
            install(context -> HandlerResponse.empty(204), executor);

            var response = exchange(request("/"));

            assertEquals(503, response.status().code());
            response.release();
            assertEquals(0, connectionManager.getInFlightCount());
        }

        @Test
        @DisplayName("Should close a channel that was never registered")
        void shouldCloseUnregisteredChannel() {
            channel.pipeline().addLast(new RequestDispatchHandler(
                connectionManager, new HeaderTrustResolver(), TrustConfig.disabled(),
                context -> HandlerResponse.empty(204), new DirectExecutorService(), Duration.ofSeconds(5)));

            channel.writeInbound(request("/"));

            assertNull(channel.readOutbound());
            assertFalse(channel.isOpen());
        }
    }

    /**
     * Runs tasks on the submitting thread, so the embedded channel is only touched by the test thread.
     */
    private static final class DirectExecutorService extends AbstractExecutorService {

        private volatile boolean shutdown;

        @Override
        public void execute(Runnable command) {
            if (shutdown) {
                throw new RejectedExecutionException("shut down");
            }
            command.run();
        }

        @Override
        public void shutdown() {
            shutdown = true;
        }

        @Override
        public List<Runnable> shutdownNow() {
            shutdown = true;
            return List.of();
        }

        @Override
        public boolean isShutdown() {
            return shutdown;
        }

        @Override
        public boolean isTerminated() {
            return shutdown;
        }

        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) {
            return shutdown;
        }
    }
}

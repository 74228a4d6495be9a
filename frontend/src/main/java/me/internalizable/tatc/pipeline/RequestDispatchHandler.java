package me.internalizable.tatc.pipeline;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderResult;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.timeout.ReadTimeoutException;
import io.netty.util.concurrent.ScheduledFuture;
import me.internalizable.tatc.api.http.HandlerResponse;
import me.internalizable.tatc.api.http.RequestContext;
import me.internalizable.tatc.api.http.RequestHandler;
import me.internalizable.tatc.api.http.RequestHeaders;
import me.internalizable.tatc.connection.Connection;
import me.internalizable.tatc.connection.ConnectionManager;
import me.internalizable.tatc.connection.InboundRequest;
import me.internalizable.tatc.trust.HeaderTrustResolver;
import me.internalizable.tatc.trust.TrustConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns each aggregated HTTP request into a {@link RequestContext} and runs the application handler
 * for it.
 *
 * <p>Flow for one request:</p>
 * <ol>
 *   <li>The request head and body are copied out of Netty buffers into an {@link InboundRequest}</li>
 *   <li>The {@link HeaderTrustResolver} applies the forwarding headers</li>
 *   <li>The handler runs on the worker pool, never on the event loop</li>
 *   <li>The response is written with {@code Connection: close} and the connection is closed</li>
 * </ol>
 *
 * <p>If the handler does not finish within the request timeout its task is cancelled and only this
 * connection is closed. Handler exceptions, and responses that cannot be encoded, become
 * {@code 500} responses on this connection. Requests pipelined behind the first one are dropped.</p>
 */
public class RequestDispatchHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestDispatchHandler.class);
    private static final Logger ACCESS_LOGGER = LoggerFactory.getLogger("me.internalizable.tatc.access");

    private final ConnectionManager connectionManager;
    private final HeaderTrustResolver resolver;
    private final TrustConfig trustConfig;
    private final RequestHandler handler;
    private final ExecutorService handlerExecutor;
    private final Duration requestTimeout;

    // event loop only
    private boolean served;

    public RequestDispatchHandler(@Nonnull ConnectionManager connectionManager,
                                  @Nonnull HeaderTrustResolver resolver,
                                  @Nonnull TrustConfig trustConfig,
                                  @Nonnull RequestHandler handler,
                                  @Nonnull ExecutorService handlerExecutor,
                                  @Nonnull Duration requestTimeout) {
        this.connectionManager = connectionManager;
        this.resolver = resolver;
        this.trustConfig = trustConfig;
        this.handler = handler;
        this.handlerExecutor = handlerExecutor;
        this.requestTimeout = requestTimeout;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        Connection connection = connectionManager.getConnection(ctx.channel());
        if (connection == null) {
            LOGGER.error("Received request on unregistered channel {}", ctx.channel());
            ctx.close();
            return;
        }

        // Only the first request on a connection is served; every response closes it
        if (served) {
            LOGGER.debug("Connection {}: dropping pipelined request {} {}",
                    connection.getConnectionId(), request.method(), request.uri());
            return;
        }
        served = true;
        ctx.channel().config().setAutoRead(false);
        if (ctx.pipeline().get(FrontendChannelInitializer.READ_TIMEOUT) != null) {
            ctx.pipeline().remove(FrontendChannelInitializer.READ_TIMEOUT);
        }

        DecoderResult decoderResult = request.decoderResult();
        if (decoderResult.isFailure()) {
            LOGGER.debug("Connection {}: malformed request", connection.getConnectionId(), decoderResult.cause());
            writeAndClose(ctx, toNettyResponse(HandlerResponse.text(HttpResponseStatus.BAD_REQUEST.code(), "Bad Request")));
            return;
        }

        InboundRequest inbound = toInboundRequest(request);
        RequestContext context = resolver.resolve(connection, inbound, trustConfig);

        AtomicBoolean finished = new AtomicBoolean();
        connectionManager.requestStarted();

        Future<?> task;
        try {
            task = handlerExecutor.submit(() -> runHandler(ctx, connection, context, finished));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Connection {}: handler pool is shut down, rejecting request", connection.getConnectionId());
            if (finished.compareAndSet(false, true)) {
                connectionManager.requestFinished();
            }
            writeAndClose(ctx, toNettyResponse(
                    HandlerResponse.text(HttpResponseStatus.SERVICE_UNAVAILABLE.code(), "Service Unavailable")));
            return;
        }

        ScheduledFuture<?> timeout = ctx.executor().schedule(() -> {
            if (finished.compareAndSet(false, true)) {
                task.cancel(true);
                connectionManager.requestFinished();
                LOGGER.warn("Connection {}: request {} {} timed out after {} ms, closing connection",
                        connection.getConnectionId(), context.method(), context.target(), requestTimeout.toMillis());
                connection.close();
            }
        }, requestTimeout.toMillis(), TimeUnit.MILLISECONDS);

        ctx.channel().closeFuture().addListener(future -> timeout.cancel(false));
    }

    private void runHandler(ChannelHandlerContext ctx, Connection connection, RequestContext context,
                            AtomicBoolean finished) {
        HandlerResponse response;
        try {
            response = handler.handle(context);
            if (response == null) {
                LOGGER.error("Connection {}: handler returned no response for {} {}",
                        connection.getConnectionId(), context.method(), context.target());
                response = internalError();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.debug("Connection {}: handler interrupted", connection.getConnectionId());
            if (finished.compareAndSet(false, true)) {
                connectionManager.requestFinished();
                connection.close();
            }
            return;
        } catch (Exception e) {
            LOGGER.error("Connection {}: handler failed for {} {}",
                    connection.getConnectionId(), context.method(), context.target(), e);
            response = internalError();
        }

        if (!finished.compareAndSet(false, true)) {
            // timed out or cancelled, connection already closed
            return;
        }
        boolean written = false;
        try {
            FullHttpResponse nettyResponse = encode(connection, context, response);
            ACCESS_LOGGER.info("{} - \"{} {}\" {}", context.clientAddress(), context.method(),
                    context.target(), nettyResponse.status().code());
            written = writeAndClose(ctx, nettyResponse);
        } finally {
            connectionManager.requestFinished();
            if (!written) {
                connection.close();
            }
        }
    }

    private static FullHttpResponse encode(Connection connection, RequestContext context, HandlerResponse response) {
        try {
            return toNettyResponse(response);
        } catch (RuntimeException e) {
            LOGGER.error("Connection {}: response for {} {} could not be encoded",
                    connection.getConnectionId(), context.method(), context.target(), e);
            return toNettyResponse(internalError());
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        Connection connection = connectionManager.getConnection(ctx.channel());
        Object id = connection != null ? connection.getConnectionId() : ctx.channel().id();

        if (cause instanceof ReadTimeoutException) {
            LOGGER.debug("Connection {}: no complete request in time, closing", id);
        } else if (cause instanceof IOException) {
            LOGGER.warn("Connection {}: I/O error: {}", id, cause.getMessage());
        } else {
            LOGGER.error("Connection {}: unexpected error", id, cause);
        }
        ctx.close();
    }

    // ==================== Conversion ====================

    static InboundRequest toInboundRequest(FullHttpRequest request) {
        RequestHeaders.Builder headers = RequestHeaders.builder();
        var it = request.headers().iteratorAsString();
        while (it.hasNext()) {
            Map.Entry<String, String> header = it.next();
            headers.add(header.getKey(), header.getValue());
        }
        byte[] body = ByteBufUtil.getBytes(request.content());
        return new InboundRequest(request.method().name(), request.uri(), headers.build(), body);
    }

    static FullHttpResponse toNettyResponse(HandlerResponse response) {
        FullHttpResponse nettyResponse = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.valueOf(response.status()),
                Unpooled.wrappedBuffer(response.body()));
        try {
            for (Map.Entry<String, String> header : response.headers()) {
                nettyResponse.headers().add(header.getKey(), header.getValue());
            }
        } catch (RuntimeException e) {
            nettyResponse.release();
            throw e;
        }
        nettyResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, nettyResponse.content().readableBytes());
        nettyResponse.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        return nettyResponse;
    }

    private static HandlerResponse internalError() {
        return HandlerResponse.text(HttpResponseStatus.INTERNAL_SERVER_ERROR.code(), "Internal Server Error");
    }

    /**
     * @return {@code false} if the channel was already inactive and nothing was written
     */
    private static boolean writeAndClose(ChannelHandlerContext ctx, FullHttpResponse response) {
        if (!ctx.channel().isActive()) {
            response.release();
            return false;
        }
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        return true;
    }
}

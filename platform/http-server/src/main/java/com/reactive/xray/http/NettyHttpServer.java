package com.reactive.xray.http;

import com.reactive.xray.context.TracingConfig;
import com.reactive.xray.emit.UdpEmitter;
import com.reactive.xray.http.server.HttpServerSpec;
import com.reactive.xray.http.server.ResponseLifecycle;
import com.reactive.xray.http.server.SimpleRequest;
import com.reactive.xray.http.server.interceptors.LoggingInterceptor;
import com.reactive.xray.http.server.interceptors.SegmentInterceptor;
import com.reactive.xray.observe.Log;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.*;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * HTTP server adapter on Netty.
 *
 * Each request gets a {@link ResponseLifecycle}:
 * - finish fires once the response write completed
 * - close fires if the connection closes before that (client abort, write failure)
 *
 * Handler failures (thrown or as a failed future) become a 500 response after
 * the interceptor chain has seen them.
 */
public final class NettyHttpServer implements HttpServerSpec {

    private final Map<RouteKey, Handler> routes = new ConcurrentHashMap<>();
    private final List<Interceptor> interceptors = new CopyOnWriteArrayList<>();

    @Override
    public HttpServerSpec route(Method method, String path, Handler handler) {
        routes.put(new RouteKey(method, path), handler);
        return this;
    }

    @Override
    public HttpServerSpec intercept(Interceptor interceptor) {
        interceptors.add(interceptor);
        return this;
    }

    @Override
    public ServerHandle start(int port) {
        return start(port, ServerConfig.defaults());
    }

    @Override
    public ServerHandle start(int port, ServerConfig config) {
        return new NettyHandle(port, config, chain());
    }

    /**
     * Routing handler wrapped by the interceptors, first registered outermost.
     */
    Handler chain() {
        Handler handler = request -> {
            Handler route = routes.get(new RouteKey(request.method(), request.path()));
            return route != null
                ? route.handle(request)
                : CompletableFuture.completedFuture(Response.notFound());
        };
        List<Interceptor> reversed = new ArrayList<>(interceptors);
        Collections.reverse(reversed);
        for (Interceptor interceptor : reversed) {
            handler = interceptor.around(handler);
        }
        return handler;
    }

    private record RouteKey(Method method, String path) {}

    // ========================================================================
    // Netty Server Handle
    // ========================================================================

    private static final class NettyHandle implements ServerHandle {
        private final EventLoopGroup bossGroup;
        private final EventLoopGroup workerGroup;
        private final Channel serverChannel;
        private final AtomicLong requestCount = new AtomicLong();

        NettyHandle(int port, ServerConfig config, Handler handler) {
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup(config.workerThreads());

            try {
                ServerBootstrap b = new ServerBootstrap();
                b.group(bossGroup, workerGroup)
                        .channel(NioServerSocketChannel.class)
                        .option(ChannelOption.SO_BACKLOG, config.backlog())
                        .option(ChannelOption.SO_REUSEADDR, true)
                        .childOption(ChannelOption.SO_KEEPALIVE, true)
                        .childOption(ChannelOption.TCP_NODELAY, true)
                        .childHandler(new ChannelInitializer<SocketChannel>() {
                            @Override
                            protected void initChannel(SocketChannel ch) {
                                ch.pipeline()
                                        .addLast(new HttpServerCodec())
                                        .addLast(new HttpObjectAggregator(config.maxRequestSize()))
                                        .addLast(new RequestHandler(handler, requestCount));
                            }
                        });

                serverChannel = b.bind(port).sync().channel();
                Log.info("[NettyHttpServer] Started on port {}", port());

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workerGroup.shutdownGracefully();
                bossGroup.shutdownGracefully();
                throw new IllegalStateException("Failed to start server", e);
            }
        }

        @Override
        public void awaitTermination() throws InterruptedException {
            serverChannel.closeFuture().sync();
        }

        @Override
        public int port() {
            return ((InetSocketAddress) serverChannel.localAddress()).getPort();
        }

        @Override
        public long requestCount() {
            return requestCount.get();
        }

        @Override
        public void close() {
            serverChannel.close();
            workerGroup.shutdownGracefully();
            bossGroup.shutdownGracefully();
            Log.info("[NettyHttpServer] Stopped");
        }
    }

    // ========================================================================
    // Request Handler
    // ========================================================================

    private static final class RequestHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
        private final Handler handler;
        private final AtomicLong requestCount;

        RequestHandler(Handler handler, AtomicLong requestCount) {
            this.handler = handler;
            this.requestCount = requestCount;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest nettyReq) {
            requestCount.incrementAndGet();
            boolean keepAlive = HttpUtil.isKeepAlive(nettyReq);

            ResponseLifecycle lifecycle = new ResponseLifecycle();
            ChannelFutureListener onConnectionClosed = f -> lifecycle.close();
            ctx.channel().closeFuture().addListener(onConnectionClosed);

            Method method;
            try {
                method = Method.valueOf(nettyReq.method().name());
            } catch (IllegalArgumentException e) {
                sendResponse(ctx, Response.error(405, "Method Not Allowed"), keepAlive, lifecycle, onConnectionClosed);
                return;
            }

            // The Netty request is released when this method returns; copy what we need.
            Request request = toRequest(method, nettyReq, ctx.channel().remoteAddress(), lifecycle);

            CompletableFuture<Response> future;
            try {
                future = handler.handle(request);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }

            future.whenComplete((response, error) -> {
                Response out = error != null ? Response.serverError(describe(error)) : response;
                sendResponse(ctx, out, keepAlive, lifecycle, onConnectionClosed);
            });
        }

        private static Request toRequest(Method method, FullHttpRequest nettyReq,
                                         SocketAddress remote, ResponseLifecycle lifecycle) {
            // Parse path and query
            QueryStringDecoder decoder = new QueryStringDecoder(nettyReq.uri());
            Map<String, String> queryParams = new HashMap<>();
            decoder.parameters().forEach((k, v) -> {
                if (!v.isEmpty()) queryParams.put(k, v.get(0));
            });

            // Parse headers
            Map<String, String> headers = new HashMap<>();
            nettyReq.headers().forEach(e ->
                    headers.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue()));

            // Get body
            ByteBuf content = nettyReq.content();
            byte[] body = new byte[content.readableBytes()];
            content.readBytes(body);

            String clientAddress = remote instanceof InetSocketAddress inet && inet.getAddress() != null
                    ? inet.getAddress().getHostAddress()
                    : "";

            return new SimpleRequest(method, decoder.path(), headers, queryParams, body,
                    clientAddress, lifecycle, Map.of());
        }

        private static void sendResponse(ChannelHandlerContext ctx, Response response, boolean keepAlive,
                                         ResponseLifecycle lifecycle, ChannelFutureListener onConnectionClosed) {
            ByteBuf content = Unpooled.wrappedBuffer(response.body());
            int length = content.readableBytes();

            FullHttpResponse nettyResponse = new DefaultFullHttpResponse(
                    HttpVersion.HTTP_1_1,
                    HttpResponseStatus.valueOf(response.status()),
                    content
            );

            // Set headers
            response.headers().forEach((k, v) ->
                    nettyResponse.headers().set(k, v));
            nettyResponse.headers().set(HttpHeaderNames.CONTENT_LENGTH, length);

            // Keep-alive handling
            if (keepAlive) {
                nettyResponse.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            }

            lifecycle.setStatus(response.status());
            ctx.writeAndFlush(nettyResponse).addListener((ChannelFutureListener) f -> {
                ctx.channel().closeFuture().removeListener(onConnectionClosed);
                if (f.isSuccess()) {
                    lifecycle.finish(response.status(), length);
                } else {
                    Log.debug("Response write failed: {}", String.valueOf(f.cause()));
                    lifecycle.close();
                }
                if (!keepAlive || !f.isSuccess()) {
                    ctx.close();
                }
            });
        }

        private static String describe(Throwable error) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return message.replace("\"", "'");
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            Log.debug("Closing connection after error: {}", cause.toString());
            ctx.close();
        }
    }

    // ========================================================================
    // Standalone entry point
    // ========================================================================

    public static void main(String[] args) throws Exception {
        int port = args.length > 0 ? Integer.parseInt(args[0]) : 8080;

        TracingConfig tracing = TracingConfig.load();
        try (UdpEmitter emitter = new UdpEmitter(tracing.daemonAddress())) {
            SegmentInterceptor segments = SegmentInterceptor.fromConfig(tracing, emitter);

            HttpServerSpec server = new NettyHttpServer()
                .intercept(segments)
                .intercept(LoggingInterceptor.all(segments.store()))
                .get("/health", Handler.sync(req -> Response.ok("{\"status\":\"UP\"}")));

            try (ServerHandle handle = server.start(port)) {
                Log.info("Server running. Press Ctrl+C to stop.");
                handle.awaitTermination();
            }
        }
    }
}

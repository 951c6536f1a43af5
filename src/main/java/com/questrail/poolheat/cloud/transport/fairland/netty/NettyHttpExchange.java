package com.questrail.poolheat.cloud.transport.fairland.netty;

import com.questrail.poolheat.api.TransportException;
import com.questrail.poolheat.cloud.transport.fairland.HttpExchange;
import com.questrail.poolheat.cloud.transport.fairland.HttpReply;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.ReadTimeoutHandler;

import javax.net.ssl.SSLException;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * NettyHttpExchange
 * =============================================================================
 * Netty-backed implementation of the {@link HttpExchange} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT parse
 * JSON, interpret vendor status codes, or retry.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Response bodies are copied into
 * {@code byte[]}; all reference-counted buffers are released internally.
 *
 * <h2>Failures</h2>
 * Malformed or oversized responses and TLS failures are fatal; connect, IO and
 * timeout failures are retryable. HTTP error statuses are returned as replies.
 *
 * <h2>Connections</h2>
 * One connection per request, closed once the response arrives.
 *
 * <h2>Lifecycle</h2>
 * {@link #close()} shuts down the event loop group.
 */
public final class NettyHttpExchange implements HttpExchange
{
    private static final int MAX_RESPONSE_BYTES = 4 * 1024 * 1024;

    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final EventLoopGroup group;
    private final SslContext sslContext;

    public NettyHttpExchange(Duration connectTimeout, Duration requestTimeout)
    {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        try {
            this.sslContext = SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw TransportException.fatal("cannot initialise TLS client context", e);
        }
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public HttpReply post(URI uri, Map<String, String> headers, byte[] body)
    {
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(headers, "headers");
        Objects.requireNonNull(body, "body");

        boolean https = "https".equalsIgnoreCase(uri.getScheme());
        String host = uri.getHost();
        int port = uri.getPort() != -1 ? uri.getPort() : (https ? 443 : 80);
        CompletableFuture<HttpReply> reply = new CompletableFuture<>();

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (https) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new ReadTimeoutHandler(requestTimeout.toMillis(), TimeUnit.MILLISECONDS));
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_RESPONSE_BYTES));
                        p.addLast(new ResponseHandler(reply));
                    }
                });

        ChannelFuture connect = bootstrap.connect(host, port);
        connect.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                reply.completeExceptionally(future.cause());
                return;
            }
            future.channel().writeAndFlush(request(uri, host, headers, body))
                    .addListener((ChannelFutureListener) write -> {
                        if (!write.isSuccess()) {
                            reply.completeExceptionally(write.cause());
                        }
                    });
        });

        long waitMillis = connectTimeout.toMillis() + requestTimeout.toMillis();
        try {
            return reply.get(waitMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw TransportException.retryable("POST " + uri.getPath() + ": no response within " + waitMillis + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw TransportException.retryable("POST " + uri.getPath() + ": interrupted", e);
        } catch (ExecutionException e) {
            throw classify("POST " + uri.getPath(), e.getCause());
        } finally {
            connect.channel().close();
        }
    }

    @Override
    public void close()
    {
        group.shutdownGracefully();
    }

    /**
     * Undecodable, oversized and TLS-rejected responses will not improve on a
     * retry; connect, IO and read timeout failures may.
     */
    static TransportException classify(String operation, Throwable cause)
    {
        for (Throwable t = cause; t != null; t = t.getCause()) {
            if (t instanceof DecoderException || t instanceof SSLException) {
                return TransportException.fatal(operation + ": " + t, cause);
            }
        }
        return TransportException.retryable(operation + ": " + cause, cause);
    }

    private static FullHttpRequest request(URI uri, String host, Map<String, String> headers, byte[] body)
    {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }

        FullHttpRequest request = new DefaultFullHttpRequest(
                HttpVersion.HTTP_1_1, HttpMethod.POST, path, Unpooled.wrappedBuffer(body));
        request.headers().set(HttpHeaderNames.HOST, host);
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        request.headers().set(HttpHeaderNames.CONTENT_LENGTH, body.length);
        headers.forEach((name, value) -> request.headers().set(name, value));
        return request;
    }

    /**
     * ResponseHandler
     * -------------------------------------------------------------------------
     * Copies the aggregated response out of Netty and completes the caller's
     * future.
     */
    private static final class ResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse>
    {
        private final CompletableFuture<HttpReply> reply;

        ResponseHandler(CompletableFuture<HttpReply> reply)
        {
            this.reply = reply;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpResponse response)
        {
            if (response.decoderResult().isFailure()) {
                reply.completeExceptionally(new DecoderException("malformed response", response.decoderResult().cause()));
                ctx.close();
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            ByteBuf content = response.content();
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            reply.complete(new HttpReply(response.status().code(), bytes));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            reply.completeExceptionally(new IOException("connection closed before response"));
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            reply.completeExceptionally(cause);
            ctx.close();
        }
    }
}

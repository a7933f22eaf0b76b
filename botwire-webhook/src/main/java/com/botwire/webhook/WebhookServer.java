package com.botwire.webhook;

import com.botwire.api.binding.BotJson;
import com.botwire.api.binding.JacksonUpdateParser;
import com.botwire.api.binding.UpdateParser;
import com.botwire.api.errors.MalformedUpdateException;
import com.botwire.api.types.Update;
import com.botwire.common.config.BotConfig;
import com.botwire.common.errors.BotException;
import com.botwire.common.infra.DedupeCache;
import com.botwire.dispatch.Bot;
import com.botwire.dispatch.Dispatcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Objects;

import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Netty HTTP endpoint receiving pushed updates.
 * <p>
 * Only {@code POST {path}} is served. When a secret token is configured the
 * {@code X-Telegram-Bot-Api-Secret-Token} header must match it (403 otherwise). Every accepted body
 * is answered with 200, including bodies that cannot be parsed and updates whose handlers fail, so
 * the platform does not redeliver them. Redelivered update ids within the dedupe window are
 * acknowledged and dropped.
 * <p>
 * Handlers run on a separate executor group, never on the Netty I/O threads.
 */
@Slf4j
public class WebhookServer implements AutoCloseable {

    public static final String SECRET_HEADER = "X-Telegram-Bot-Api-Secret-Token";

    private final UpdateParser parser;
    private final Dispatcher dispatcher;
    private final BotConfig.WebhookConfig config;
    private final DedupeCache dedupe;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;

    public WebhookServer(Bot bot, BotConfig.WebhookConfig config) {
        this(bot.getApi().getUpdateParser(), bot.getDispatcher(), config);
    }

    public WebhookServer(Dispatcher dispatcher, BotConfig.WebhookConfig config) {
        this(new JacksonUpdateParser(), dispatcher, config);
    }

    public WebhookServer(UpdateParser parser, Dispatcher dispatcher, BotConfig.WebhookConfig config) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.config = config != null ? config : new BotConfig.WebhookConfig();
        this.dedupe = new DedupeCache(this.config.getDedupeTtlMs(), this.config.getDedupeMaxSize());
    }

    // =========================================================================
    // Lifecycle
    // =========================================================================

    /**
     * Bind to the configured host and port; port 0 picks a free port, see {@link #getPort()}.
     *
     * @throws BotException if the address cannot be bound
     */
    public synchronized void start() {
        if (serverChannel != null) {
            log.debug("Webhook server already running");
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(2);
        handlerGroup = new DefaultEventExecutorGroup(4);
        WebhookHandler handler = new WebhookHandler();
        try {
            ServerBootstrap b = new ServerBootstrap();
            b.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            ch.pipeline().addLast(new HttpServerCodec(),
                                    new HttpObjectAggregator(config.getMaxBodyBytes()));
                            ch.pipeline().addLast(handlerGroup, "webhook", handler);
                        }
                    });
            serverChannel = b.bind(config.getHost(), config.getPort()).sync().channel();
            log.info("Webhook listening on http://{}:{}{}", config.getHost(), getPort(), config.getPath());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdown();
            throw new BotException("Interrupted while binding webhook server", e);
        } catch (Exception e) {
            log.error("Webhook server failed to bind {}:{}: {}", config.getHost(), config.getPort(), e.getMessage());
            shutdown();
            throw new BotException("Cannot bind webhook server to " + config.getHost() + ":" + config.getPort(), e);
        }
    }

    /**
     * Actual bound port, or -1 when not running.
     */
    public synchronized int getPort() {
        if (serverChannel == null)
            return -1;
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public synchronized boolean isRunning() {
        return serverChannel != null;
    }

    /**
     * Stop accepting requests. The dispatcher is left running; it belongs to the caller.
     */
    @Override
    public synchronized void close() {
        if (serverChannel == null)
            return;
        shutdown();
        log.info("Webhook server stopped");
    }

    private void shutdown() {
        if (serverChannel != null) {
            serverChannel.close().syncUninterruptibly();
            serverChannel = null;
        }
        if (workerGroup != null)
            workerGroup.shutdownGracefully();
        if (bossGroup != null)
            bossGroup.shutdownGracefully();
        if (handlerGroup != null)
            handlerGroup.shutdownGracefully();
    }

    // =========================================================================
    // Request handling
    // =========================================================================

    HttpResponseStatus handle(HttpMethod method, String path, String secretHeader, String body) {
        if (!config.getPath().equals(path)) {
            return NOT_FOUND;
        }
        if (!HttpMethod.POST.equals(method)) {
            return METHOD_NOT_ALLOWED;
        }
        if (!secretMatches(secretHeader)) {
            log.warn("Rejected webhook request with a missing or wrong secret token");
            return FORBIDDEN;
        }

        JsonNode record;
        try {
            record = BotJson.mapper().readTree(body);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring webhook body that is not JSON: {}", e.getOriginalMessage());
            return OK;
        }
        Update update;
        try {
            update = parser.parse(record);
        } catch (MalformedUpdateException e) {
            log.warn("Ignoring malformed webhook update {}: {}", e.getUpdateId(), e.getMessage());
            return OK;
        }
        if (dedupe.isDuplicate(String.valueOf(update.getUpdateId()))) {
            log.debug("Dropping redelivered update {}", update.getUpdateId());
            return OK;
        }
        dispatcher.dispatchBatch(List.of(update));
        return OK;
    }

    private boolean secretMatches(String provided) {
        String expected = config.getSecretToken();
        if (expected == null || expected.isEmpty())
            return true;
        if (provided == null)
            return false;
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8));
    }

    @ChannelHandler.Sharable
    private class WebhookHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
            String path = new QueryStringDecoder(request.uri()).path();
            HttpResponseStatus status;
            try {
                status = handle(request.method(), path, request.headers().get(SECRET_HEADER),
                        request.content().toString(StandardCharsets.UTF_8));
            } catch (Exception e) {
                log.error("Webhook error on {}: {}", path, e.getMessage(), e);
                status = OK;
            }
            respond(ctx, request, status);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            log.error("Webhook channel error: {}", cause.getMessage(), cause);
            ctx.close();
        }

        private void respond(ChannelHandlerContext ctx, FullHttpRequest request, HttpResponseStatus status) {
            byte[] bytes = status == OK ? new byte[0] : status.reasonPhrase().getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            if (status == METHOD_NOT_ALLOWED) {
                response.headers().set(HttpHeaderNames.ALLOW, "POST");
            }
            boolean keepAlive = HttpUtil.isKeepAlive(request);
            HttpUtil.setKeepAlive(response, keepAlive);
            var future = ctx.writeAndFlush(response);
            if (!keepAlive) {
                future.addListener(ChannelFutureListener.CLOSE);
            }
        }
    }
}

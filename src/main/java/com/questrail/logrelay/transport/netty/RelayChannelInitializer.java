package com.questrail.logrelay.transport.netty;

import com.questrail.logrelay.admission.AdmissionLimiter;
import com.questrail.logrelay.internal.time.MonotonicClock;
import com.questrail.logrelay.transport.HttpRoutes;
import com.questrail.logrelay.transport.RelayTransportListener;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateHandler;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Pipeline for one accepted relay connection.
 *
 * <pre>
 *   HttpServerCodec -> HttpObjectAggregator -> IdleStateHandler(reader, pingInterval)
 *     -> HttpGatewayHandler -> WebSocketServerProtocolHandler
 *     -> WebSocketFrameAggregator -> RelayWebSocketHandler
 * </pre>
 */
final class RelayChannelInitializer extends ChannelInitializer<Channel>
{
    static final int MAX_HTTP_CONTENT = 64 * 1024;
    static final int MAX_FRAME_SIZE = 64 * 1024;

    private final String websocketPath;
    private final Duration pingInterval;
    private final Duration pingTimeout;
    private final AdmissionLimiter limiter;
    private final MonotonicClock clock;
    private final Predicate<String> originPolicy;
    private final HttpRoutes routes;
    private final RelayTransportListener listener;

    RelayChannelInitializer(
            String websocketPath,
            Duration pingInterval,
            Duration pingTimeout,
            AdmissionLimiter limiter,
            MonotonicClock clock,
            Predicate<String> originPolicy,
            HttpRoutes routes,
            RelayTransportListener listener)
    {
        this.websocketPath = Objects.requireNonNull(websocketPath, "websocketPath");
        this.pingInterval = Objects.requireNonNull(pingInterval, "pingInterval");
        this.pingTimeout = Objects.requireNonNull(pingTimeout, "pingTimeout");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.originPolicy = Objects.requireNonNull(originPolicy, "originPolicy");
        this.routes = Objects.requireNonNull(routes, "routes");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    protected void initChannel(Channel ch)
    {
        ChannelPipeline p = ch.pipeline();
        p.addLast(new HttpServerCodec());
        p.addLast(new HttpObjectAggregator(MAX_HTTP_CONTENT));
        // Every inbound read resets it, pong frames included.
        p.addLast(new IdleStateHandler(pingInterval.toMillis(), 0, 0, TimeUnit.MILLISECONDS));
        p.addLast(new HttpGatewayHandler(websocketPath, limiter, clock, originPolicy, routes));
        p.addLast(new WebSocketServerProtocolHandler(websocketPath, null, true, MAX_FRAME_SIZE));
        p.addLast(new WebSocketFrameAggregator(MAX_FRAME_SIZE));
        p.addLast(new RelayWebSocketHandler(listener, pingInterval, pingTimeout));
    }
}

package com.questrail.logrelay.transport.netty;

import com.questrail.logrelay.transport.RelayTransportListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * RelayWebSocketHandler
 * -----------------------------------------------------------------------------
 * Last handler of a relay channel. Bridges one upgraded channel to the
 * {@link RelayTransportListener}.
 *
 * <ul>
 *   <li>Handshake complete: create the endpoint, {@code onOpen}</li>
 *   <li>Text frame: {@code onText}; other data frames are ignored</li>
 *   <li>Channel inactive: {@code onClose}, once</li>
 *   <li>Reader idle for one ping interval: send a WebSocket ping</li>
 *   <li>Reader idle for the ping timeout: close the channel</li>
 * </ul>
 * Clients answer pings with pongs, and any read restarts the idle count, so
 * a subscriber that only listens stays connected while its peer is alive.
 * Channels that never completed the upgrade are closed on the first idle
 * event.
 *
 * All callbacks run on the channel's event loop and are therefore serialized.
 * One instance per channel.
 */
final class RelayWebSocketHandler extends SimpleChannelInboundHandler<WebSocketFrame>
{
    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    private final RelayTransportListener listener;
    private final int idleEventsBeforeClose;

    private NettyClientEndpoint endpoint;
    private boolean closed;
    private int idleEvents;

    RelayWebSocketHandler(RelayTransportListener listener, Duration pingInterval, Duration pingTimeout)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
        Objects.requireNonNull(pingInterval, "pingInterval");
        Objects.requireNonNull(pingTimeout, "pingTimeout");
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("pingInterval must be positive");
        }
        // Idle events arrive once per interval of silence.
        long ratio = (pingTimeout.toMillis() + pingInterval.toMillis() - 1) / pingInterval.toMillis();
        this.idleEventsBeforeClose = (int) Math.max(1, Math.min(Integer.MAX_VALUE, ratio));
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
    {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            endpoint = new NettyClientEndpoint(ctx.channel());
            listener.onOpen(endpoint);
        }
        else if (evt instanceof IdleStateEvent idle && idle.state() == IdleState.READER_IDLE) {
            onReaderIdle(ctx, idle);
        }
        else {
            super.userEventTriggered(ctx, evt);
        }
    }

    private void onReaderIdle(ChannelHandlerContext ctx, IdleStateEvent idle)
    {
        idleEvents = idle.isFirst() ? 1 : idleEvents + 1;
        if (endpoint == null || idleEvents >= idleEventsBeforeClose) {
            log.info("Closing idle channel {}", ctx.channel().id().asShortText());
            ctx.close();
            return;
        }
        log.debug("Pinging idle channel {}", endpoint.id());
        ctx.writeAndFlush(new PingWebSocketFrame());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, WebSocketFrame frame)
    {
        if (endpoint == null) {
            return;
        }
        if (frame instanceof TextWebSocketFrame text) {
            listener.onText(endpoint, text.text());
        }
        else {
            log.debug("Ignoring {} on channel {}", frame.getClass().getSimpleName(), endpoint.id());
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception
    {
        if (endpoint != null && !closed) {
            closed = true;
            listener.onClose(endpoint);
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.warn("WebSocket channel {} failed; closing", ctx.channel().id().asShortText(), cause);
        ctx.close();
    }
}

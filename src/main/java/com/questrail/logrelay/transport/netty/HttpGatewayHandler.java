package com.questrail.logrelay.transport.netty;

import com.questrail.logrelay.admission.AdmissionDecision;
import com.questrail.logrelay.admission.AdmissionLimiter;
import com.questrail.logrelay.internal.time.MonotonicClock;
import com.questrail.logrelay.transport.HttpRoutes;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import io.netty.util.CharsetUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * HttpGatewayHandler
 * =============================================================================
 * First stop for every HTTP request on a relay channel.
 *
 * <ol>
 *   <li>Every request is counted against its origin's rate window; an exhausted
 *       origin gets {@code 429} with a {@code Retry-After} header.</li>
 *   <li>A WebSocket upgrade on the configured path whose {@code Origin} header
 *       is acceptable is passed on to the handshake handler; an unacceptable
 *       origin gets {@code 403}.</li>
 *   <li>Any other {@code GET} is answered from {@link HttpRoutes}, or
 *       {@code 404}. Other methods get {@code 405}.</li>
 * </ol>
 * Every response carries the same JSON content type and security headers.
 */
final class HttpGatewayHandler extends SimpleChannelInboundHandler<FullHttpRequest>
{
    private static final Logger log = LoggerFactory.getLogger(HttpGatewayHandler.class);

    private final String websocketPath;
    private final AdmissionLimiter limiter;
    private final MonotonicClock clock;
    private final Predicate<String> originPolicy;
    private final HttpRoutes routes;

    HttpGatewayHandler(
            String websocketPath,
            AdmissionLimiter limiter,
            MonotonicClock clock,
            Predicate<String> originPolicy,
            HttpRoutes routes)
    {
        // Requests forwarded to the handshake handler change owner, so release is manual.
        super(false);
        this.websocketPath = Objects.requireNonNull(websocketPath, "websocketPath");
        this.limiter = Objects.requireNonNull(limiter, "limiter");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.originPolicy = Objects.requireNonNull(originPolicy, "originPolicy");
        this.routes = Objects.requireNonNull(routes, "routes");
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        boolean forwarded = false;
        try {
            forwarded = route(ctx, request);
        } finally {
            if (!forwarded) {
                request.release();
            }
        }
    }

    private boolean route(ChannelHandlerContext ctx, FullHttpRequest request)
    {
        String origin = NettyClientEndpoint.originOf(ctx.channel());
        AdmissionDecision decision = limiter.admit(origin, clock.nowMillis());
        if (decision instanceof AdmissionDecision.Rejected rejected) {
            FullHttpResponse response = json(HttpResponseStatus.TOO_MANY_REQUESTS,
                    "{\"error\":\"Too Many Requests\",\"message\":\"" + rejected.failure().message()
                            + "\",\"retryAfter\":" + rejected.retryAfterSeconds() + "}");
            response.headers().set(HttpHeaderNames.RETRY_AFTER, rejected.retryAfterSeconds());
            respond(ctx, request, response);
            return false;
        }

        String path = new QueryStringDecoder(request.uri()).path();

        if (path.equals(websocketPath) && isUpgrade(request)) {
            String browserOrigin = request.headers().get(HttpHeaderNames.ORIGIN);
            if (!originPolicy.test(browserOrigin)) {
                log.warn("Rejected WebSocket upgrade from {} with origin {}", origin, browserOrigin);
                respond(ctx, request, json(HttpResponseStatus.FORBIDDEN,
                        "{\"error\":\"Forbidden\",\"message\":\"Origin not allowed\"}"));
                return false;
            }
            ctx.fireChannelRead(request);
            return true;
        }

        if (!HttpMethod.GET.equals(request.method())) {
            respond(ctx, request, json(HttpResponseStatus.METHOD_NOT_ALLOWED,
                    "{\"error\":\"Method Not Allowed\"}"));
            return false;
        }

        Optional<String> body = routes.get(path);
        if (body.isPresent()) {
            respond(ctx, request, json(HttpResponseStatus.OK, body.get()));
        }
        else {
            respond(ctx, request, json(HttpResponseStatus.NOT_FOUND,
                    "{\"error\":\"Not Found\",\"message\":\"No route for " + path.replace("\"", "") + "\"}"));
        }
        return false;
    }

    private static boolean isUpgrade(FullHttpRequest request)
    {
        return HttpMethod.GET.equals(request.method())
                && "websocket".equalsIgnoreCase(request.headers().get(HttpHeaderNames.UPGRADE));
    }

    private static FullHttpResponse json(HttpResponseStatus status, String body)
    {
        ByteBuf content = Unpooled.copiedBuffer(body, CharsetUtil.UTF_8);
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status, content);
        response.headers()
                .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON + "; charset=utf-8")
                .set("X-Frame-Options", "DENY")
                .set("X-Content-Type-Options", "nosniff")
                .set("Content-Security-Policy", "default-src 'self'")
                .set("Referrer-Policy", "strict-origin-when-cross-origin");
        HttpUtil.setContentLength(response, content.readableBytes());
        return response;
    }

    private static void respond(ChannelHandlerContext ctx, FullHttpRequest request, FullHttpResponse response)
    {
        boolean keepAlive = HttpUtil.isKeepAlive(request);
        HttpUtil.setKeepAlive(response, keepAlive);
        if (keepAlive) {
            ctx.writeAndFlush(response);
        }
        else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
    {
        log.warn("HTTP channel {} failed; closing", ctx.channel().id().asShortText(), cause);
        ctx.close();
    }
}

package com.questrail.logrelay.transport.netty;

import com.questrail.logrelay.admission.AdmissionLimiter;
import com.questrail.logrelay.admission.AdmissionPolicy;
import com.questrail.logrelay.time.ManualMonotonicClock;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.CharsetUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HttpGatewayHandlerTest
 * -----------------------------------------------------------------------------
 * Exercises request routing on an {@link EmbeddedChannel}. Upgrades that pass
 * the gateway surface as inbound messages at the end of the pipeline.
 */
class HttpGatewayHandlerTest {

    private static final String ALLOWED_ORIGIN = "https://dashboard.example";

    private ManualMonotonicClock clock;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        AdmissionLimiter limiter = new AdmissionLimiter(new AdmissionPolicy(Duration.ofMinutes(1), 3));
        channel = new EmbeddedChannel(new HttpGatewayHandler(
            "/ws",
            limiter,
            clock,
            origin -> origin == null || ALLOWED_ORIGIN.equals(origin),
            path -> "/health".equals(path) ? Optional.of("{\"status\":\"ok\"}") : Optional.empty()));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    @Test
    void knownRouteIsServedAsJsonWithSecurityHeaders() {
        FullHttpResponse response = exchange(get("/health?verbose=1"));

        try {
            assertEquals(HttpResponseStatus.OK, response.status());
            assertEquals("{\"status\":\"ok\"}", response.content().toString(CharsetUtil.UTF_8));
            assertTrue(response.headers().get(HttpHeaderNames.CONTENT_TYPE).startsWith("application/json"));
            assertEquals("DENY", response.headers().get("X-Frame-Options"));
            assertEquals("nosniff", response.headers().get("X-Content-Type-Options"));
            assertTrue(channel.isOpen(), "keep-alive connection stays open");
        } finally {
            response.release();
        }
    }

    @Test
    void unknownRouteIsNotFound() {
        FullHttpResponse response = exchange(get("/nope"));

        try {
            assertEquals(HttpResponseStatus.NOT_FOUND, response.status());
            assertTrue(response.content().toString(CharsetUtil.UTF_8).contains("No route for /nope"));
        } finally {
            response.release();
        }
    }

    @Test
    void nonGetIsNotAllowed() {
        FullHttpResponse response = exchange(
            new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, "/health"));

        try {
            assertEquals(HttpResponseStatus.METHOD_NOT_ALLOWED, response.status());
        } finally {
            response.release();
        }
    }

    @Test
    void exhaustedOriginGetsTooManyRequests() {
        for (int i = 0; i < 3; i++) {
            exchange(get("/health")).release();
        }
        clock.advanceMillis(15_500);

        FullHttpResponse response = exchange(get("/health"));

        try {
            assertEquals(HttpResponseStatus.TOO_MANY_REQUESTS, response.status());
            assertEquals("45", response.headers().get(HttpHeaderNames.RETRY_AFTER));
            String body = response.content().toString(CharsetUtil.UTF_8);
            assertTrue(body.contains("\"retryAfter\":45"), body);
            assertTrue(body.contains("Rate limit exceeded. Please try again later."), body);
        } finally {
            response.release();
        }
    }

    @Test
    void upgradeFromAllowedOriginIsForwarded() {
        FullHttpRequest upgrade = upgrade(ALLOWED_ORIGIN);

        channel.writeInbound(upgrade);

        assertNull(channel.readOutbound(), "gateway must not answer a forwarded upgrade");
        FullHttpRequest forwarded = channel.readInbound();
        assertSame(upgrade, forwarded);
        assertEquals(1, forwarded.refCnt(), "ownership passes on with the request");
        forwarded.release();
    }

    @Test
    void upgradeWithoutOriginHeaderIsForwarded() {
        channel.writeInbound(upgrade(null));

        FullHttpRequest forwarded = channel.readInbound();
        assertNotNull(forwarded);
        forwarded.release();
    }

    @Test
    void upgradeFromForeignOriginIsForbidden() {
        FullHttpResponse response = exchange(upgrade("https://evil.example"));

        try {
            assertEquals(HttpResponseStatus.FORBIDDEN, response.status());
            assertNull(channel.readInbound());
        } finally {
            response.release();
        }
    }

    @Test
    void connectionCloseIsHonoured() {
        FullHttpRequest request = get("/health");
        request.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);

        exchange(request).release();
        channel.runPendingTasks();

        assertFalse(channel.isOpen());
    }

    private FullHttpResponse exchange(FullHttpRequest request) {
        channel.writeInbound(request);
        FullHttpResponse response = channel.readOutbound();
        assertNotNull(response, "expected a response");
        assertEquals(0, request.refCnt(), "answered requests are released");
        return response;
    }

    private static FullHttpRequest get(String uri) {
        return new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri);
    }

    private static FullHttpRequest upgrade(String origin) {
        FullHttpRequest request = get("/ws");
        request.headers()
            .set(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET)
            .set(HttpHeaderNames.CONNECTION, HttpHeaderValues.UPGRADE);
        if (origin != null) {
            request.headers().set(HttpHeaderNames.ORIGIN, origin);
        }
        return request;
    }
}

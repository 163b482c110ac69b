package com.questrail.logrelay.transport.netty;

import com.questrail.logrelay.transport.ClientEndpoint;
import com.questrail.logrelay.transport.RelayTransportListener;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.handler.timeout.IdleStateEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelayWebSocketHandlerTest {

    private static final Duration PING_INTERVAL = Duration.ofSeconds(25);
    private static final Duration PING_TIMEOUT = Duration.ofSeconds(60);

    private RecordingListener listener;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        listener = new RecordingListener();
        channel = new EmbeddedChannel(new RelayWebSocketHandler(listener, PING_INTERVAL, PING_TIMEOUT));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    @Test
    void handshakeOpensEndpoint() {
        completeHandshake();

        assertEquals(List.of("open"), listener.calls);
        ClientEndpoint endpoint = listener.endpoint;
        assertEquals(channel.id().asLongText(), endpoint.id());
        assertNotNull(endpoint.origin());
        assertTrue(endpoint.isOpen());
    }

    @Test
    void framesBeforeHandshakeAreIgnored() {
        channel.writeInbound(new TextWebSocketFrame("{\"event\":\"ping\"}"));

        assertTrue(listener.calls.isEmpty());
    }

    @Test
    void textFramesReachTheListener() {
        completeHandshake();

        channel.writeInbound(new TextWebSocketFrame("{\"event\":\"ping\"}"));
        channel.writeInbound(new BinaryWebSocketFrame(Unpooled.wrappedBuffer(new byte[] {1, 2})));

        assertEquals(List.of("open", "text:{\"event\":\"ping\"}"), listener.calls);
    }

    @Test
    void endpointWritesTextFrames() {
        completeHandshake();

        listener.endpoint.sendText("{\"event\":\"pong\"}");

        TextWebSocketFrame frame = channel.readOutbound();
        try {
            assertEquals("{\"event\":\"pong\"}", frame.text());
        } finally {
            frame.release();
        }
    }

    @Test
    void silentSubscriberIsPingedInsteadOfClosed() {
        completeHandshake();

        // 25 s and 50 s of silence: pinged, still open.
        channel.pipeline().fireUserEventTriggered(IdleStateEvent.FIRST_READER_IDLE_STATE_EVENT);
        channel.pipeline().fireUserEventTriggered(IdleStateEvent.READER_IDLE_STATE_EVENT);

        assertPinged();
        assertPinged();
        assertTrue(channel.isOpen());

        // The pong restarts the idle count, so the silence never reaches the timeout.
        for (int i = 0; i < 5; i++) {
            channel.pipeline().fireUserEventTriggered(IdleStateEvent.FIRST_READER_IDLE_STATE_EVENT);
            assertPinged();
        }
        assertTrue(channel.isOpen());
        assertEquals(List.of("open"), listener.calls);
    }

    @Test
    void unansweredPingsCloseTheChannelOnceTheTimeoutIsReached() {
        completeHandshake();

        channel.pipeline().fireUserEventTriggered(IdleStateEvent.FIRST_READER_IDLE_STATE_EVENT);
        assertPinged();
        channel.pipeline().fireUserEventTriggered(IdleStateEvent.READER_IDLE_STATE_EVENT);
        assertPinged();
        assertTrue(channel.isOpen());

        // 75 s of silence exceeds the 60 s timeout.
        channel.pipeline().fireUserEventTriggered(IdleStateEvent.READER_IDLE_STATE_EVENT);
        channel.runPendingTasks();
        channel.close();

        assertFalse(channel.isOpen());
        assertEquals(List.of("open", "close"), listener.calls);
        assertFalse(listener.endpoint.isOpen());
    }

    @Test
    void idleChannelWithoutUpgradeIsClosed() {
        channel.pipeline().fireUserEventTriggered(IdleStateEvent.FIRST_READER_IDLE_STATE_EVENT);
        channel.runPendingTasks();

        assertFalse(channel.isOpen());
        assertTrue(listener.calls.isEmpty());
    }

    @Test
    void closeWithoutHandshakeIsSilent() {
        channel.close();

        assertTrue(listener.calls.isEmpty());
    }

    private void assertPinged() {
        Object frame = channel.readOutbound();
        assertInstanceOf(PingWebSocketFrame.class, frame);
        ((PingWebSocketFrame) frame).release();
    }

    private void completeHandshake() {
        channel.pipeline().fireUserEventTriggered(
            new WebSocketServerProtocolHandler.HandshakeComplete("/ws", new DefaultHttpHeaders(), null));
    }

    private static final class RecordingListener implements RelayTransportListener {
        private final List<String> calls = new ArrayList<>();
        private ClientEndpoint endpoint;

        @Override
        public void onOpen(ClientEndpoint endpoint) {
            this.endpoint = endpoint;
            calls.add("open");
        }

        @Override
        public void onText(ClientEndpoint endpoint, String frame) {
            calls.add("text:" + frame);
        }

        @Override
        public void onClose(ClientEndpoint endpoint) {
            calls.add("close");
        }
    }
}

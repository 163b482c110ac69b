package com.questrail.logrelay.transport.netty;

import com.questrail.logrelay.admission.AdmissionLimiter;
import com.questrail.logrelay.internal.time.MonotonicClock;
import com.questrail.logrelay.transport.HttpRoutes;
import com.questrail.logrelay.transport.RelayTransportListener;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * NettyRelayServer
 * =============================================================================
 * Netty-backed HTTP/WebSocket server for the relay.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT:
 * <ul>
 *   <li>Decode relay frames or interpret events</li>
 *   <li>Touch subscriptions, pollers or cursors</li>
 *   <li>Schedule polls</li>
 * </ul>
 * Inbound text frames reach the {@link RelayTransportListener} verbatim.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start()} binds the listening socket and blocks until bound.
 * - {@link #stop()} closes the server channel and shuts the event loops down.
 */
public final class NettyRelayServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyRelayServer.class);

    private final InetSocketAddress bindAddress;
    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;
    private final String websocketPath;

    private volatile Channel serverChannel;

    private NettyRelayServer(Builder b)
    {
        this.bindAddress = Objects.requireNonNull(b.bindAddress, "bindAddress");
        this.websocketPath = Objects.requireNonNull(b.websocketPath, "websocketPath");
        RelayChannelInitializer initializer = new RelayChannelInitializer(
                b.websocketPath, b.pingInterval, b.pingTimeout, b.limiter, b.clock, b.originPolicy, b.routes, b.listener);

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
        this.bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(initializer);
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public void start() throws InterruptedException
    {
        if (serverChannel != null) {
            return;
        }
        serverChannel = bootstrap.bind(bindAddress).sync().channel();
        log.info("Relay listening on {} (WebSocket path {})", serverChannel.localAddress(), websocketPath);
    }

    /**
     * Port actually bound; useful when binding to port 0.
     *
     * @throws IllegalStateException if the server is not started
     */
    public int boundPort()
    {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("server not started");
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    public void stop()
    {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
        }
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        log.info("Relay server stopped");
    }

    public static final class Builder
    {
        private InetSocketAddress bindAddress = new InetSocketAddress(4000);
        private String websocketPath = "/ws";
        private Duration pingInterval = Duration.ofSeconds(25);
        private Duration pingTimeout = Duration.ofSeconds(60);
        private AdmissionLimiter limiter;
        private MonotonicClock clock;
        private Predicate<String> originPolicy = origin -> true;
        private HttpRoutes routes = path -> Optional.empty();
        private RelayTransportListener listener;

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withWebsocketPath(String websocketPath) {
            this.websocketPath = websocketPath;
            return this;
        }

        /**
         * Silence after which an upgraded channel is sent a WebSocket ping.
         */
        public Builder withPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        /**
         * Silence after which a channel is closed.
         */
        public Builder withPingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
            return this;
        }

        public Builder withAdmissionLimiter(AdmissionLimiter limiter) {
            this.limiter = limiter;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withOriginPolicy(Predicate<String> originPolicy) {
            this.originPolicy = originPolicy;
            return this;
        }

        public Builder withRoutes(HttpRoutes routes) {
            this.routes = routes;
            return this;
        }

        public Builder withListener(RelayTransportListener listener) {
            this.listener = listener;
            return this;
        }

        public NettyRelayServer build() {
            return new NettyRelayServer(this);
        }
    }
}

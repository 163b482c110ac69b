package com.questrail.logrelay.transport.netty;

import com.questrail.logrelay.transport.ClientEndpoint;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Objects;

/**
 * {@link ClientEndpoint} over an upgraded Netty channel.
 *
 * <p>{@link #sendText(String)} is safe from any thread: Netty hands writes from
 * foreign threads to the channel's event loop.</p>
 */
final class NettyClientEndpoint implements ClientEndpoint
{
    private final Channel channel;
    private final String id;
    private final String origin;

    NettyClientEndpoint(Channel channel)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.id = channel.id().asLongText();
        this.origin = originOf(channel);
    }

    @Override
    public String id()
    {
        return id;
    }

    @Override
    public String origin()
    {
        return origin;
    }

    @Override
    public void sendText(String frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (channel.isActive()) {
            channel.writeAndFlush(new TextWebSocketFrame(frame));
        }
    }

    @Override
    public boolean isOpen()
    {
        return channel.isActive();
    }

    @Override
    public void close()
    {
        channel.close();
    }

    @Override
    public String toString()
    {
        return "NettyClientEndpoint[" + id + " from " + origin + "]";
    }

    /**
     * Admission identity of a channel: the peer's IP address where there is one.
     */
    static String originOf(Channel channel)
    {
        SocketAddress remote = channel.remoteAddress();
        if (remote instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return String.valueOf(remote);
    }
}

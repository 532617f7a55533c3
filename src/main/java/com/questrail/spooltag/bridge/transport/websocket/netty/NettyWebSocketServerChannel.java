package com.questrail.spooltag.bridge.transport.websocket.netty;

import com.questrail.spooltag.bridge.transport.MessageChannel;
import com.questrail.spooltag.bridge.transport.MessageChannelListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * NettyWebSocketServerChannel
 * =============================================================================
 * Agent-side {@link MessageChannel}: accepts WebSocket connections from a
 * bridge session on one path.
 *
 * <p>Exactly one peer is served. A new connection replaces the current one,
 * which is closed. The listener sees {@code onChannelUp} when a peer completes
 * its handshake and {@code onChannelDown} when that peer goes away.</p>
 *
 * <p>Netty types MUST NOT escape this package.</p>
 */
public final class NettyWebSocketServerChannel implements MessageChannel
{
    private static final int MAX_FRAME_BYTES = 65536;

    private final InetSocketAddress bindAddress;
    private final String path;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;
    private final ServerBootstrap bootstrap;

    private volatile MessageChannelListener listener;
    private volatile Channel serverChannel;
    private volatile Channel peer;

    public NettyWebSocketServerChannel(InetSocketAddress bindAddress, String path)
    {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.path = Objects.requireNonNull(path, "path");

        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup(1);
        this.bootstrap = new ServerBootstrap();

        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new HttpServerCodec());
                        p.addLast(new HttpObjectAggregator(MAX_FRAME_BYTES));
                        p.addLast(new WebSocketServerProtocolHandler(NettyWebSocketServerChannel.this.path));
                        p.addLast(new PeerHandler());
                    }
                });
    }

    @Override
    public void setListener(MessageChannelListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /** Binds the listening socket. Calling it while bound has no effect. */
    @Override
    public void start()
    {
        MessageChannelListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MessageChannelListener must be set before start()");
        }
        if (serverChannel != null) {
            return;
        }

        ChannelFuture f = bootstrap.bind(bindAddress);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                serverChannel = future.channel();
            }
            else {
                l.onChannelDown(future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        Channel p = peer;
        if (p != null) {
            p.close();
        }
        Channel s = serverChannel;
        if (s != null) {
            s.close();
        }
        workerGroup.shutdownGracefully();
        bossGroup.shutdownGracefully();
    }

    @Override
    public boolean send(String text)
    {
        Objects.requireNonNull(text, "text");
        Channel p = peer;
        if (p == null || !p.isActive()) {
            return false;
        }
        p.writeAndFlush(new TextWebSocketFrame(text));
        return true;
    }

    @Override
    public boolean isOpen()
    {
        Channel p = peer;
        return p != null && p.isActive();
    }

    /**
     * PeerHandler
     * -------------------------------------------------------------------------
     * One per accepted connection.
     */
    private final class PeerHandler extends SimpleChannelInboundHandler<TextWebSocketFrame>
    {
        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
                Channel previous = peer;
                peer = ctx.channel();
                if (previous != null && previous != ctx.channel()) {
                    previous.close();
                }
                MessageChannelListener l = listener;
                if (l != null) {
                    l.onChannelUp();
                }
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame)
        {
            MessageChannelListener l = listener;
            if (l != null && ctx.channel() == peer) {
                l.onMessage(frame.text());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            // A replaced peer going away is not a down.
            if (ctx.channel() != peer) {
                return;
            }
            peer = null;
            MessageChannelListener l = listener;
            if (l != null) {
                l.onChannelDown(null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            if (ctx.channel() == peer) {
                peer = null;
                MessageChannelListener l = listener;
                if (l != null) {
                    l.onChannelDown(cause);
                }
            }
            ctx.close();
        }
    }
}

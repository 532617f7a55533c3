package com.questrail.spooltag.bridge.transport.websocket.netty;

import com.questrail.spooltag.bridge.transport.MessageChannel;
import com.questrail.spooltag.bridge.transport.MessageChannelListener;

import io.netty.bootstrap.Bootstrap;
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
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketClientProtocolHandler;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import javax.net.ssl.SSLException;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyWebSocketChannel
 * =============================================================================
 * Netty-backed WebSocket client implementation of the {@link MessageChannel} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT parse
 * envelopes, emit session events or schedule reconnects.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package. Inbound text frames are delivered
 * to the listener as {@code String}.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} connects and performs the WebSocket handshake; the
 *       listener sees {@code onChannelUp} when the handshake completes.</li>
 *   <li>A lost connection reports {@code onChannelDown} once; {@link #start()}
 *       may then be called again.</li>
 *   <li>{@link #stop()} closes the channel and shuts down the event loop group.</li>
 * </ul>
 */
public final class NettyWebSocketChannel implements MessageChannel
{
    private static final int MAX_FRAME_BYTES = 65536;

    private final URI uri;
    private final String host;
    private final int port;
    private final SslContext sslContext;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private volatile MessageChannelListener listener;
    private volatile Channel channel;
    private volatile boolean open;
    private volatile AtomicBoolean downReported = new AtomicBoolean(true);

    public NettyWebSocketChannel(URI uri)
    {
        this.uri = Objects.requireNonNull(uri, "uri");
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase();
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("unsupported scheme: " + uri);
        }
        this.host = Objects.requireNonNull(uri.getHost(), "uri host");
        boolean secure = scheme.equals("wss");
        this.port = uri.getPort() != -1 ? uri.getPort() : (secure ? 443 : 80);
        this.sslContext = secure ? clientSslContext() : null;

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), host, port));
                        }
                        p.addLast(new HttpClientCodec());
                        p.addLast(new HttpObjectAggregator(MAX_FRAME_BYTES));
                        // Handshakers are stateful: one per connection.
                        p.addLast(new WebSocketClientProtocolHandler(
                                WebSocketClientHandshakerFactory.newHandshaker(
                                        NettyWebSocketChannel.this.uri, WebSocketVersion.V13, null, true,
                                        new DefaultHttpHeaders(), MAX_FRAME_BYTES)));
                        p.addLast(new InboundHandler());
                    }
                });
    }

    private static SslContext clientSslContext()
    {
        try {
            return SslContextBuilder.forClient().build();
        } catch (SSLException e) {
            throw new IllegalStateException("cannot initialise TLS client context", e);
        }
    }

    @Override
    public void setListener(MessageChannelListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        MessageChannelListener l = requireListener();

        AtomicBoolean attemptDown = new AtomicBoolean(false);
        downReported = attemptDown;

        ChannelFuture f = bootstrap.connect(host, port);
        f.addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                channel = future.channel();
            }
            else {
                reportDown(attemptDown, l, future.cause());
            }
        });
    }

    @Override
    public void stop()
    {
        MessageChannelListener l = listener;

        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        group.shutdownGracefully();

        if (l != null) {
            reportDown(downReported, l, null);
        }
    }

    @Override
    public boolean send(String text)
    {
        Objects.requireNonNull(text, "text");

        Channel ch = channel;
        if (!open || ch == null || !ch.isActive()) {
            return false;
        }

        ch.writeAndFlush(new TextWebSocketFrame(text));
        return true;
    }

    @Override
    public boolean isOpen()
    {
        return open;
    }

    private void reportDown(AtomicBoolean attemptDown, MessageChannelListener l, Throwable cause)
    {
        open = false;
        channel = null;
        if (attemptDown.compareAndSet(false, true)) {
            l.onChannelDown(cause);
        }
    }

    private MessageChannelListener requireListener()
    {
        MessageChannelListener l = listener;
        if (l == null) {
            throw new IllegalStateException("MessageChannelListener must be set before start()");
        }
        return l;
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives text frames after the handshake and forwards them to the port
     * listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<TextWebSocketFrame>
    {
        private final AtomicBoolean attemptDown = downReported;

        @Override
        public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception
        {
            if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_COMPLETE) {
                open = true;
                MessageChannelListener l = listener;
                if (l != null) {
                    l.onChannelUp();
                }
            }
            else if (evt == WebSocketClientProtocolHandler.ClientHandshakeStateEvent.HANDSHAKE_TIMEOUT) {
                ctx.close();
            }
            super.userEventTriggered(ctx, evt);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame)
        {
            MessageChannelListener l = listener;
            if (l != null) {
                l.onMessage(frame.text());
            }
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            MessageChannelListener l = listener;
            if (l != null) {
                reportDown(attemptDown, l, null);
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            MessageChannelListener l = listener;
            if (l != null) {
                reportDown(attemptDown, l, cause);
            }
            ctx.close();
        }
    }
}

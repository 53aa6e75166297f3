package com.questrail.triggerware.protocol.jsonrpc.transport.tcp.netty;

import com.questrail.triggerware.protocol.jsonrpc.transport.StreamEndpoint;
import com.questrail.triggerware.protocol.jsonrpc.transport.StreamEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.*;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyTcpStreamEndpoint
 * =============================================================================
 * Netty-backed implementation of the {@link StreamEndpoint} port.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Parse JSON or delimit messages</li>
 *   <li>Interpret JSON-RPC semantics</li>
 *   <li>Reconnect or retry</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <p>Inbound bytes are copied into {@code byte[]} and emitted to the port
 * listener. All reference-counted buffers are released internally.</p>
 *
 * <h2>Threading</h2>
 * A dedicated single-threaded {@link NioEventLoopGroup} owns the socket. That
 * event loop is the one receive task of the client: every listener callback
 * runs on it, in stream order.
 */
public final class NettyTcpStreamEndpoint implements StreamEndpoint
{
    private final InetSocketAddress remoteAddress;

    private final EventLoopGroup group;
    private final Bootstrap bootstrap;

    private final AtomicBoolean down = new AtomicBoolean();

    private volatile StreamEndpointListener listener;
    private volatile Channel channel;

    public NettyTcpStreamEndpoint(InetSocketAddress remoteAddress, Duration connectTimeout)
    {
        this.remoteAddress = Objects.requireNonNull(remoteAddress, "remoteAddress");
        Objects.requireNonNull(connectTimeout, "connectTimeout");

        this.group = new NioEventLoopGroup(1);
        this.bootstrap = new Bootstrap();

        bootstrap.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                .handler(new ChannelInitializer<NioSocketChannel>() {
                    @Override
                    protected void initChannel(NioSocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast(new InboundHandler());
                    }
                });
    }

    @Override
    public void setListener(StreamEndpointListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        StreamEndpointListener l = requireListener();

        ChannelFuture f = bootstrap.connect(remoteAddress).awaitUninterruptibly();
        if (!f.isSuccess()) {
            group.shutdownGracefully();
            transportDown(f.cause());
            throw new IllegalStateException("Failed to connect to " + remoteAddress, f.cause());
        }

        channel = f.channel();
        l.onTransportUp();
    }

    @Override
    public void stop()
    {
        Channel ch = channel;
        if (ch != null) {
            ch.close();
        }

        // Shut down the event loop group; callable from the event loop itself.
        group.shutdownGracefully();

        transportDown(null);
    }

    @Override
    public void send(byte[] payload)
    {
        Objects.requireNonNull(payload, "payload");

        Channel ch = channel;
        if (ch == null) {
            throw new IllegalStateException("Endpoint is not connected");
        }

        ByteBuf buf = Unpooled.wrappedBuffer(payload);
        // A failed write surfaces through exceptionCaught and tears the connection down.
        ch.writeAndFlush(buf).addListener(ChannelFutureListener.FIRE_EXCEPTION_ON_FAILURE);
    }

    private StreamEndpointListener requireListener()
    {
        StreamEndpointListener l = listener;
        if (l == null) {
            throw new IllegalStateException("StreamEndpointListener must be set before start()");
        }
        return l;
    }

    private void transportDown(Throwable cause)
    {
        if (!down.compareAndSet(false, true)) {
            return;
        }
        StreamEndpointListener l = listener;
        if (l != null) {
            l.onTransportDown(cause);
        }
    }

    /**
     * InboundHandler
     * -------------------------------------------------------------------------
     * Receives Netty {@link ByteBuf}s and forwards raw bytes to the port
     * listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf content)
        {
            StreamEndpointListener l = listener;
            if (l == null || content.readableBytes() == 0) {
                return;
            }

            // Copy the payload into a plain byte[] (Netty containment rule).
            byte[] bytes = new byte[content.readableBytes()];
            content.getBytes(content.readerIndex(), bytes);

            l.onBytes(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx)
        {
            // Peer closed the stream (zero-length read) or we closed it locally.
            transportDown(null);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause)
        {
            transportDown(cause);
            ctx.close();
        }
    }
}

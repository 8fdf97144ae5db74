package io.taskrelay.transport;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.protobuf.ProtobufDecoder;
import io.netty.handler.codec.protobuf.ProtobufEncoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import io.netty.handler.flush.FlushConsolidationHandler;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.EventExecutorGroup;
import io.taskrelay.api.RelayApi;
import io.taskrelay.publisher.Publisher;
import io.taskrelay.registry.SubscriptionRegistry;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;

/**
 * TCP endpoint for subscribers and remote publishers, speaking varint32-framed {@link RelayApi.Envelope}s.
 */
@Slf4j
public class NettyTransport implements AutoCloseable {
    @Getter private int port;
    private final SubscriptionRegistry registry;
    private final Publisher publisher;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private EventExecutorGroup handlerGroup;
    private Channel serverChannel;

    public NettyTransport(final int port, final SubscriptionRegistry registry, final Publisher publisher) {
        this.port = port;
        this.registry = registry;
        this.publisher = publisher;
    }

    public void start() throws InterruptedException {
        /*
         * 1 boss thread accepts connections, I/O on the default worker count.
         * Request handling runs on its own group: publish forces the log to disk.
         */
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        handlerGroup = new DefaultEventExecutorGroup(Math.max(2, Runtime.getRuntime().availableProcessors()));

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        configure(ch.pipeline(), handlerGroup, registry, publisher);
                    }
                })
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        final ChannelFuture f = b.bind(port).sync();
        serverChannel = f.channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Relay transport listening on port {}", port);
    }

    /**
     * Server pipeline: flush consolidation, varint32 protobuf framing, then the request handler on
     * {@code handlerGroup} (the channel's own event loop when null).
     */
    static void configure(final ChannelPipeline p,
                          final EventExecutorGroup handlerGroup,
                          final SubscriptionRegistry registry,
                          final Publisher publisher) {
        /*
         * Consolidate flushes to reduce syscalls when a subscriber drains a backlog.
         * 256 pending flushes, or the end of the current read, trigger the actual write.
         */
        p.addLast(new FlushConsolidationHandler(256, true));

        /* Protocol Buffers Framing (Varint32 Length Prefix) */
        p.addLast(new ProtobufVarint32FrameDecoder());
        p.addLast(new ProtobufDecoder(RelayApi.Envelope.getDefaultInstance()));
        p.addLast(new ProtobufVarint32LengthFieldPrepender());
        p.addLast(new ProtobufEncoder());

        p.addLast(handlerGroup, "relay", new RelayRequestHandler(registry, publisher));
    }

    public void stop() {
        if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        if (bossGroup != null) bossGroup.shutdownGracefully().syncUninterruptibly();
        if (workerGroup != null) workerGroup.shutdownGracefully().syncUninterruptibly();
        if (handlerGroup != null) handlerGroup.shutdownGracefully().syncUninterruptibly();
    }

    @Override
    public void close() {
        stop();
    }
}

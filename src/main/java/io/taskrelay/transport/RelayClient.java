package io.taskrelay.transport;

import com.google.protobuf.UnsafeByteOperations;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.protobuf.ProtobufDecoder;
import io.netty.handler.codec.protobuf.ProtobufEncoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import io.taskrelay.api.RelayApi;
import io.taskrelay.core.model.EventType;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Client side of the relay protocol for subscribers and remote mutation services.
 * <p>
 * Requests return a future completed with the server's {@link RelayApi.Reply}; pushes (events, missed-events
 * notices, session closure) go to the listener on the client's I/O thread.
 * </p>
 */
@Slf4j
public final class RelayClient implements AutoCloseable {

    private final Channel channel;
    private final EventLoopGroup group;

    private final ConcurrentMap<Long, CompletableFuture<RelayApi.Reply>> pending = new ConcurrentHashMap<>();
    private final AtomicLong corrSeq = new AtomicLong(1L);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RelayClient(final String host, final int port, final Consumer<RelayApi.Envelope> pushListener)
            throws InterruptedException {
        this.group = new NioEventLoopGroup(1);

        final Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new ProtobufVarint32FrameDecoder())
                                .addLast(new ProtobufDecoder(RelayApi.Envelope.getDefaultInstance()))
                                .addLast(new ProtobufVarint32LengthFieldPrepender())
                                .addLast(new ProtobufEncoder())
                                .addLast(new SimpleChannelInboundHandler<RelayApi.Envelope>() {
                                    @Override
                                    protected void channelRead0(final ChannelHandlerContext ctx, final RelayApi.Envelope env) {
                                        if (env.getKindCase() == RelayApi.Envelope.KindCase.REPLY) {
                                            final CompletableFuture<RelayApi.Reply> f = pending.remove(env.getCorrelationId());
                                            if (f != null) f.complete(env.getReply());
                                        } else {
                                            pushListener.accept(env);
                                        }
                                    }

                                    @Override
                                    public void channelInactive(final ChannelHandlerContext ctx) {
                                        failPending();
                                    }
                                });
                    }
                });

        this.channel = bootstrap.connect(new InetSocketAddress(host, port)).sync().channel();
        log.debug("RelayClient connected to {}:{}", host, port);
    }

    public CompletableFuture<RelayApi.Reply> subscribe(final String subscriberId, final Collection<String> taskIds) {
        final RelayApi.SubscribeRequest.Builder req = RelayApi.SubscribeRequest.newBuilder().setSubscriberId(subscriberId);
        if (taskIds == null || taskIds.isEmpty()) {
            req.setAllTasks(true);
        } else {
            req.addAllTaskIds(taskIds);
        }
        return request(RelayApi.Envelope.newBuilder().setSubscribe(req));
    }

    public CompletableFuture<RelayApi.Reply> connect(final String subscriberId) {
        return request(RelayApi.Envelope.newBuilder()
                .setConnect(RelayApi.ConnectRequest.newBuilder().setSubscriberId(subscriberId)));
    }

    public CompletableFuture<RelayApi.Reply> ack(final String subscriberId, final String taskId, final long sequence) {
        return request(RelayApi.Envelope.newBuilder()
                .setAck(RelayApi.AckRequest.newBuilder()
                        .setSubscriberId(subscriberId)
                        .setTaskId(taskId)
                        .setSequence(sequence)));
    }

    public CompletableFuture<RelayApi.Reply> disconnect(final String subscriberId) {
        return request(RelayApi.Envelope.newBuilder()
                .setDisconnect(RelayApi.DisconnectRequest.newBuilder().setSubscriberId(subscriberId)));
    }

    public CompletableFuture<RelayApi.Reply> unsubscribe(final String subscriberId) {
        return request(RelayApi.Envelope.newBuilder()
                .setUnsubscribe(RelayApi.UnsubscribeRequest.newBuilder().setSubscriberId(subscriberId)));
    }

    public CompletableFuture<RelayApi.Reply> publish(final String taskId, final EventType type, final byte[] payload) {
        return request(RelayApi.Envelope.newBuilder()
                .setPublish(RelayApi.PublishRequest.newBuilder()
                        .setTaskId(taskId)
                        .setKind(ProtoMapping.toKind(type))
                        .setPayload(UnsafeByteOperations.unsafeWrap(payload))));
    }

    private CompletableFuture<RelayApi.Reply> request(final RelayApi.Envelope.Builder env) {
        if (closed.get()) return CompletableFuture.failedFuture(new ClosedChannelException());

        final long corrId = corrSeq.getAndIncrement();
        final CompletableFuture<RelayApi.Reply> future = new CompletableFuture<>();
        pending.put(corrId, future);

        channel.writeAndFlush(env.setCorrelationId(corrId).build()).addListener(f -> {
            if (!f.isSuccess()) {
                pending.remove(corrId);
                future.completeExceptionally(f.cause());
                log.error("Failed to send request corrId {}: {}", corrId, f.cause().getMessage());
            }
        });
        return future;
    }

    private void failPending() {
        final ClosedChannelException ex = new ClosedChannelException();
        pending.forEach((id, f) -> f.completeExceptionally(ex));
        pending.clear();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        failPending();
        try {
            channel.close().syncUninterruptibly();
        } finally {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        }
    }
}

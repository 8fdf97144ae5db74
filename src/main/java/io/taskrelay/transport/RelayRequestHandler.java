package io.taskrelay.transport;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.taskrelay.api.RelayApi;
import io.taskrelay.ledger.log.PartitionUnavailableException;
import io.taskrelay.publisher.PublishAck;
import io.taskrelay.publisher.Publisher;
import io.taskrelay.registry.SubscriptionRegistry;
import io.taskrelay.registry.UnknownSubscriberException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-connection request handler. Runs on a dedicated executor group because publish waits for the disk.
 * Subscribers connected through this channel are disconnected when it closes.
 */
@Slf4j
@RequiredArgsConstructor
public class RelayRequestHandler extends SimpleChannelInboundHandler<RelayApi.Envelope> {

    private final SubscriptionRegistry registry;
    private final Publisher publisher;

    /* subscriber id -> sink bound to this channel; touched only from this handler's executor */
    private final Map<String, ChannelEventSink> connected = new HashMap<>();

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final RelayApi.Envelope env) {
        final long corrId = env.getCorrelationId();

        try {
            switch (env.getKindCase()) {
                case SUBSCRIBE -> {
                    final var req = env.getSubscribe();
                    registry.subscribe(req.getSubscriberId(), ProtoMapping.toInterest(req));
                    writeReply(ctx, corrId, ok());
                }

                case CONNECT -> {
                    final String id = env.getConnect().getSubscriberId();
                    final ChannelEventSink sink = new ChannelEventSink(ctx.channel(), id);
                    // replayed events may reach the client before this reply
                    registry.connect(id, sink);
                    connected.put(id, sink);
                    writeReply(ctx, corrId, ok());
                }

                case ACK -> {
                    final var req = env.getAck();
                    registry.ack(req.getSubscriberId(), req.getTaskId(), req.getSequence());
                    writeReply(ctx, corrId, ok());
                }

                case DISCONNECT -> {
                    final String id = env.getDisconnect().getSubscriberId();
                    registry.disconnect(id);
                    connected.remove(id);
                    writeReply(ctx, corrId, ok());
                }

                case UNSUBSCRIBE -> {
                    final String id = env.getUnsubscribe().getSubscriberId();
                    registry.unsubscribe(id);
                    connected.remove(id);
                    writeReply(ctx, corrId, ok());
                }

                case PUBLISH -> {
                    final var req = env.getPublish();
                    final PublishAck ack = publisher.publish(req.getTaskId(),
                            ProtoMapping.toType(req.getKind()), req.getPayload().toByteArray());
                    writeReply(ctx, corrId, ok().setSequence(ack.sequence()));
                }

                default -> {
                    log.warn("Unexpected envelope kind from {}: {}", ctx.channel().remoteAddress(), env.getKindCase());
                    writeReply(ctx, corrId, error("unsupported request " + env.getKindCase()));
                }
            }
        } catch (final UnknownSubscriberException | IllegalArgumentException | NullPointerException e) {
            writeReply(ctx, corrId, error(e.getMessage()));
        } catch (final PartitionUnavailableException e) {
            log.error("Publish failed (corrId: {}): {}", corrId, e.getMessage());
            writeReply(ctx, corrId, error(e.getMessage()));
        } catch (final Exception ex) {
            log.error("Handler error", ex);
            ctx.close();
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        for (final var e : connected.entrySet()) {
            registry.disconnect(e.getKey(), e.getValue());
        }
        connected.clear();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("Closing connection {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        ctx.close();
    }

    private static RelayApi.Reply.Builder ok() {
        return RelayApi.Reply.newBuilder().setSuccess(true);
    }

    private static RelayApi.Reply.Builder error(final String message) {
        return RelayApi.Reply.newBuilder().setSuccess(false).setError(String.valueOf(message));
    }

    private static void writeReply(final ChannelHandlerContext ctx, final long corrId, final RelayApi.Reply.Builder reply) {
        ctx.writeAndFlush(RelayApi.Envelope.newBuilder()
                .setCorrelationId(corrId)
                .setReply(reply)
                .build());
    }
}

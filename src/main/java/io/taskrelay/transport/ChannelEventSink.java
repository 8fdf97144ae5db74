package io.taskrelay.transport;

import io.netty.channel.Channel;
import io.taskrelay.api.RelayApi;
import io.taskrelay.broker.delivery.EventSink;
import io.taskrelay.broker.delivery.SinkDeliveryException;
import io.taskrelay.core.model.MissedEvents;
import io.taskrelay.core.model.TaskEvent;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * {@link EventSink} writing pushes to one client channel. Writes are queued on the channel's event loop,
 * so no call blocks the dispatcher.
 */
@Slf4j
@RequiredArgsConstructor
public final class ChannelEventSink implements EventSink {
    private final Channel channel;
    @Getter private final String subscriberId;

    @Override
    public CompletableFuture<Void> send(final TaskEvent event) {
        final CompletableFuture<Void> written = new CompletableFuture<>();
        if (!channel.isActive()) {
            written.completeExceptionally(new SinkDeliveryException("channel of " + subscriberId + " is closed"));
            return written;
        }

        final RelayApi.Envelope env = RelayApi.Envelope.newBuilder()
                .setEvent(ProtoMapping.toDelivery(event))
                .build();

        channel.writeAndFlush(env).addListener(f -> {
            if (f.isSuccess()) {
                written.complete(null);
            } else {
                written.completeExceptionally(new SinkDeliveryException(
                        "write of " + event.idempotencyKey() + " failed", f.cause()));
            }
        });
        return written;
    }

    @Override
    public void missedEvents(final MissedEvents notice) {
        push(RelayApi.Envelope.newBuilder().setMissed(ProtoMapping.toNotice(notice)).build());
    }

    @Override
    public void closed(final String reason) {
        push(RelayApi.Envelope.newBuilder()
                .setClosed(RelayApi.SessionClosed.newBuilder()
                        .setSubscriberId(subscriberId)
                        .setReason(reason))
                .build());
    }

    private void push(final RelayApi.Envelope env) {
        if (!channel.isActive()) return;
        channel.writeAndFlush(env).addListener(f -> {
            if (!f.isSuccess()) {
                log.warn("Push to subscriber {} failed: {}", subscriberId, f.cause().getMessage());
            }
        });
    }
}

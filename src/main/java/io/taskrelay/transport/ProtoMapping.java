package io.taskrelay.transport;

import com.google.protobuf.UnsafeByteOperations;
import io.taskrelay.api.RelayApi;
import io.taskrelay.core.model.EventType;
import io.taskrelay.core.model.Interest;
import io.taskrelay.core.model.MissedEvents;
import io.taskrelay.core.model.TaskEvent;

import java.util.Set;

/*
 * Conversions between domain types and wire messages.
 */
final class ProtoMapping {
    private ProtoMapping() {
    }

    static RelayApi.EventKind toKind(final EventType type) {
        return RelayApi.EventKind.forNumber(type.code());
    }

    static EventType toType(final RelayApi.EventKind kind) {
        if (kind == RelayApi.EventKind.EVENT_KIND_UNSPECIFIED || kind == RelayApi.EventKind.UNRECOGNIZED) {
            throw new IllegalArgumentException("event kind required");
        }
        return EventType.fromCode((byte) kind.getNumber());
    }

    static Interest toInterest(final RelayApi.SubscribeRequest req) {
        // No task ids is the wire form of "every task", with or without the flag.
        if (req.getAllTasks() || req.getTaskIdsCount() == 0) return Interest.all();
        return Interest.of(Set.copyOf(req.getTaskIdsList()));
    }

    static RelayApi.EventDelivery toDelivery(final TaskEvent event) {
        return RelayApi.EventDelivery.newBuilder()
                .setTaskId(event.taskId())
                .setSequence(event.sequence())
                .setKind(toKind(event.type()))
                .setPayload(UnsafeByteOperations.unsafeWrap(event.payload()))
                .setProducedAtMillis(event.producedAt().toEpochMilli())
                .build();
    }

    static RelayApi.MissedEventsNotice toNotice(final MissedEvents notice) {
        return RelayApi.MissedEventsNotice.newBuilder()
                .setTaskId(notice.taskId())
                .setPreviousCursor(notice.previousCursor())
                .setLowestRetained(notice.lowestRetained())
                .build();
    }
}

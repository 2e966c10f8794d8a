package dev.flowsync.domain.change;

import dev.flowsync.domain.enums.ChangeSource;
import dev.flowsync.domain.enums.ChangeStatus;
import dev.flowsync.domain.enums.ChangeType;

/**
 * A mutation observed from either the visual editor or the chat.
 *
 * <p>Immutable; status transitions produce a new instance. A change is created
 * PENDING, consumed by the conflict detector within the same pass, and ends
 * APPLIED or REJECTED. Changes are only retained beyond that pass inside a
 * conflict or in the short detection window.
 */
public record ChangeEvent(
        String id,
        ChangeType type,
        long timestamp,
        ChangePayload payload,
        ChangeSource source,
        String actorId,
        ChangeStatus status,
        String rejectionReason
) {
    public ChangeEvent {
        if (status == null) status = ChangeStatus.PENDING;
    }

    public ChangeEvent(String id, ChangeType type, long timestamp, ChangePayload payload,
                       ChangeSource source, String actorId) {
        this(id, type, timestamp, payload, source, actorId, ChangeStatus.PENDING, null);
    }

    public static ChangeEvent visual(String id, long timestamp, ChangePayload payload, String actorId) {
        return new ChangeEvent(id, payload.type(), timestamp, payload, ChangeSource.VISUAL, actorId);
    }

    public static ChangeEvent chat(String id, long timestamp, ChangePayload payload, String actorId) {
        return new ChangeEvent(id, payload.type(), timestamp, payload, ChangeSource.CHAT, actorId);
    }

    public ChangeEvent applied() {
        return new ChangeEvent(id, type, timestamp, payload, source, actorId, ChangeStatus.APPLIED, null);
    }

    public ChangeEvent rejected(String reason) {
        return new ChangeEvent(id, type, timestamp, payload, source, actorId, ChangeStatus.REJECTED, reason);
    }

    public boolean isApplied() {
        return status == ChangeStatus.APPLIED;
    }

    public String targetId() {
        return payload.targetId();
    }
}

package me.internalizable.lodestone.daemon.event;

import me.internalizable.lodestone.api.instance.InstanceUuid;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Progress notification for a long-running operation.
 *
 * <p>A start event and its matching end event share the same {@code eventId};
 * update events in between carry it too.</p>
 *
 * @param eventId id shared by the start, updates and end of one operation
 * @param phase lifecycle phase of this notification
 * @param timestamp epoch millis when the event was built
 * @param message human-readable message
 * @param instanceUuid instance the operation concerns, if any
 * @param totalWork total work units announced at start
 * @param progress work units completed since the previous update
 * @param success outcome, set on end events only
 * @param startValue payload of a start event
 * @param endValue payload of a successful end event
 * @param causedBy who triggered the operation
 */
public record ProgressionEvent(
        long eventId,
        @Nonnull Phase phase,
        long timestamp,
        @Nonnull String message,
        @Nullable InstanceUuid instanceUuid,
        @Nullable Double totalWork,
        @Nullable Double progress,
        @Nullable Boolean success,
        @Nullable ProgressionStartValue startValue,
        @Nullable ProgressionEndValue endValue,
        @Nonnull CausedBy causedBy
) {

    public ProgressionEvent {
        Objects.requireNonNull(phase, "phase");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(causedBy, "causedBy");
    }

    /**
     * Progression phases.
     */
    public enum Phase {
        START,
        UPDATE,
        END
    }
}

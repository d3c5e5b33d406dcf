package me.internalizable.lodestone.daemon.event;

import me.internalizable.lodestone.api.instance.InstanceUuid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fan-out of progression events to subscribers.
 *
 * <p>Sending never blocks: each subscriber has a bounded buffer and events
 * that do not fit are dropped for that subscriber only. Thread-safe for
 * concurrent send and subscribe.</p>
 */
public class EventBroadcaster {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventBroadcaster.class);

    private final int subscriberBufferCapacity;
    private final List<EventSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong nextEventId = new AtomicLong(1);

    public EventBroadcaster(int subscriberBufferCapacity) {
        if (subscriberBufferCapacity <= 0) {
            throw new IllegalArgumentException("subscriberBufferCapacity must be positive");
        }
        this.subscriberBufferCapacity = subscriberBufferCapacity;
    }

    // ==================== Subscription ====================

    /**
     * Subscribe to all subsequent events.
     *
     * @return the subscription, close it to stop receiving
     */
    @Nonnull
    public EventSubscription subscribe() {
        EventSubscription subscription = new EventSubscription(this, subscriberBufferCapacity);
        subscriptions.add(subscription);
        LOGGER.debug("Event subscriber added ({} total)", subscriptions.size());
        return subscription;
    }

    void unsubscribe(@Nonnull EventSubscription subscription) {
        subscriptions.remove(subscription);
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    // ==================== Sending ====================

    /**
     * Deliver an event to every current subscriber.
     *
     * @param event the event
     */
    public void send(@Nonnull ProgressionEvent event) {
        for (EventSubscription subscription : subscriptions) {
            if (!subscription.offer(event) && !subscription.isClosed()) {
                LOGGER.debug("Dropped event {} ({}) for a slow subscriber", event.eventId(), event.phase());
            }
        }
    }

    // ==================== Event Construction ====================

    /**
     * Build a start event with a fresh id.
     *
     * @param message description of the operation
     * @param instanceUuid instance concerned, if any
     * @param totalWork total work units, if known
     * @param startValue payload, if any
     * @param causedBy who triggered the operation
     * @return the event and its id
     */
    @Nonnull
    public ProgressionStart newProgressionStart(@Nonnull String message, @Nullable InstanceUuid instanceUuid,
                                                @Nullable Double totalWork,
                                                @Nullable ProgressionStartValue startValue,
                                                @Nonnull CausedBy causedBy) {
        long eventId = nextEventId.getAndIncrement();
        ProgressionEvent event = new ProgressionEvent(eventId, ProgressionEvent.Phase.START,
                System.currentTimeMillis(), message, instanceUuid, totalWork, null, null,
                startValue, null, causedBy);
        return new ProgressionStart(event, eventId);
    }

    /**
     * Build an intermediate progress event.
     *
     * @param eventId id from the matching start event
     * @param message progress message
     * @param progress work units completed since the last update
     * @return the event
     */
    @Nonnull
    public ProgressionEvent newProgressionUpdate(long eventId, @Nonnull String message, double progress) {
        return new ProgressionEvent(eventId, ProgressionEvent.Phase.UPDATE, System.currentTimeMillis(),
                message, null, null, progress, null, null, null, CausedBy.system());
    }

    /**
     * Build an end event.
     *
     * @param eventId id from the matching start event
     * @param success whether the operation succeeded
     * @param message outcome message, if any
     * @param endValue payload, if any
     * @return the event
     */
    @Nonnull
    public ProgressionEvent newProgressionEnd(long eventId, boolean success, @Nullable String message,
                                              @Nullable ProgressionEndValue endValue) {
        return new ProgressionEvent(eventId, ProgressionEvent.Phase.END, System.currentTimeMillis(),
                message != null ? message : "", null, null, null, success, null, endValue,
                CausedBy.system());
    }
}

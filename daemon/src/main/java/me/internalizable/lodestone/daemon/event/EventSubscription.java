package me.internalizable.lodestone.daemon.event;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A subscriber's bounded view of the event stream.
 *
 * <p>Events that arrive while the buffer is full are dropped and counted.</p>
 */
public final class EventSubscription implements AutoCloseable {

    private final EventBroadcaster broadcaster;
    private final BlockingQueue<ProgressionEvent> queue;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    EventSubscription(@Nonnull EventBroadcaster broadcaster, int capacity) {
        this.broadcaster = broadcaster;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    boolean offer(@Nonnull ProgressionEvent event) {
        if (closed) {
            return false;
        }
        if (queue.offer(event)) {
            return true;
        }
        dropped.incrementAndGet();
        return false;
    }

    /**
     * Take the next event without waiting.
     *
     * @return the next event, or null if none is buffered
     */
    @Nullable
    public ProgressionEvent poll() {
        return queue.poll();
    }

    /**
     * Wait up to the given time for the next event.
     *
     * @param timeout how long to wait
     * @param unit unit of the timeout
     * @return the next event, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    @Nullable
    public ProgressionEvent poll(long timeout, @Nonnull TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /**
     * Take every buffered event.
     *
     * @return buffered events in arrival order
     */
    @Nonnull
    public List<ProgressionEvent> drain() {
        List<ProgressionEvent> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    /**
     * Number of events dropped because the buffer was full.
     *
     * @return drop count
     */
    public long droppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            broadcaster.unsubscribe(this);
        }
    }
}

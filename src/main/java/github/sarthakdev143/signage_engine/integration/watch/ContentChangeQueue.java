package github.sarthakdev143.signage_engine.integration.watch;

import github.sarthakdev143.signage_engine.model.ContentChangeEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hands file events from the watcher thread to the periodic drain. When full, further events are dropped and
 * a single {@link ContentChangeEvent.ChangeType#OVERFLOW} event is reported on the next drain instead.
 */
public class ContentChangeQueue {

    private final BlockingQueue<ContentChangeEvent> events;
    private final Duration debounce;
    private final AtomicBoolean overflowed = new AtomicBoolean();
    private final AtomicReference<Instant> lastEventAt = new AtomicReference<>();

    public ContentChangeQueue(int capacity, Duration debounce) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive.");
        }
        this.events = new ArrayBlockingQueue<>(capacity);
        this.debounce = debounce == null ? Duration.ZERO : debounce;
    }

    /**
     * @return false when the queue was full and the event was folded into the overflow marker
     */
    public boolean offer(ContentChangeEvent event) {
        lastEventAt.set(event.detectedAt());
        if (event.type() == ContentChangeEvent.ChangeType.OVERFLOW) {
            overflowed.set(true);
            return true;
        }
        if (!events.offer(event)) {
            overflowed.set(true);
            return false;
        }
        return true;
    }

    /**
     * Returns everything queued once no event arrived for the debounce period, otherwise nothing.
     */
    public List<ContentChangeEvent> drainSettled(Instant now) {
        Instant last = lastEventAt.get();
        if (last == null || (events.isEmpty() && !overflowed.get())) {
            return List.of();
        }
        if (Duration.between(last, now).compareTo(debounce) < 0) {
            return List.of();
        }

        List<ContentChangeEvent> drained = new ArrayList<>();
        events.drainTo(drained);
        if (overflowed.getAndSet(false)) {
            drained.add(new ContentChangeEvent(null, ContentChangeEvent.ChangeType.OVERFLOW, now));
        }
        return drained;
    }

    public int size() {
        return events.size();
    }

    boolean hasOverflowed() {
        return overflowed.get();
    }
}

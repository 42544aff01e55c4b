package io.healing.event;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, append-only log of the most recent queue events. Once {@code maxLen} events are
 * held, each append drops the oldest one.
 *
 * <p>Thread-safe.
 */
public final class QueueEventStream {
    private final int maxLen;
    private final Deque<QueueEvent> events;

    public QueueEventStream(int maxLen) {
        if (maxLen <= 0) {
            throw new IllegalArgumentException("maxLen must be > 0");
        }
        this.maxLen = maxLen;
        this.events = new ArrayDeque<>(Math.min(maxLen, 1024));
    }

    public synchronized void append(QueueEvent event) {
        if (events.size() == maxLen) {
            events.pollFirst();
        }
        events.addLast(event);
    }

    /**
     * Returns up to {@code limit} of the newest events, newest first.
     */
    public synchronized List<QueueEvent> latest(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<QueueEvent> result = new ArrayList<>(Math.min(limit, events.size()));
        var it = events.descendingIterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }

    public synchronized int size() {
        return events.size();
    }

    public int maxLen() {
        return maxLen;
    }
}

package com.trellis.composition;

import java.util.ArrayList;
import java.util.List;

/**
 * Request-scoped list of notifications waiting to be shown.
 *
 * <p>Handlers append while the request is processed; the {@link FragmentComposer} delivers the
 * whole queue in one toast fragment. One instance exists per request and is never shared between
 * requests. Appends and reads are synchronized, so handlers fanning work out to other threads can
 * still enqueue safely.
 */
public final class NotificationQueue {

    private final List<Notification> entries = new ArrayList<>();

    public synchronized void enqueue(NotificationLevel level, String text) {
        entries.add(new Notification(level, text));
    }

    public synchronized void enqueueAll(List<Notification> notifications) {
        entries.addAll(notifications);
    }

    public void success(String text) {
        enqueue(NotificationLevel.SUCCESS, text);
    }

    public void info(String text) {
        enqueue(NotificationLevel.INFO, text);
    }

    public void warning(String text) {
        enqueue(NotificationLevel.WARNING, text);
    }

    public void error(String text) {
        enqueue(NotificationLevel.ERROR, text);
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    public synchronized int size() {
        return entries.size();
    }

    /** Copy of the pending entries in enqueue order; the queue is left untouched. */
    public synchronized List<Notification> peekAll() {
        return List.copyOf(entries);
    }

    /**
     * Removes the oldest {@code count} entries once they have been delivered. Entries appended
     * after the matching {@link #peekAll()} stay queued.
     */
    public synchronized void acknowledge(int count) {
        if (count < 0 || count > entries.size()) {
            throw new IllegalArgumentException(
                    "count must be between 0 and %d, was %d".formatted(entries.size(), count));
        }
        entries.subList(0, count).clear();
    }

    /** Destructive read: returns every pending entry in enqueue order and empties the queue. */
    public synchronized List<Notification> drainAll() {
        List<Notification> drained = List.copyOf(entries);
        entries.clear();
        return drained;
    }
}

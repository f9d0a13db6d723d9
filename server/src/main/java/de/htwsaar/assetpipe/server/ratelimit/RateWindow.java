package de.htwsaar.assetpipe.server.ratelimit;

import java.util.ArrayDeque;

/**
 * Zeitstempel der Requests eines Clients innerhalb des gleitenden Fensters, aufsteigend sortiert.
 *
 * <p>Nicht thread-safe; wird ausschließlich innerhalb von
 * {@link java.util.concurrent.ConcurrentHashMap#compute} verändert.</p>
 */
final class RateWindow {

    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();

    /** Entfernt alle Zeitstempel mit {@code now - t > windowMs}. */
    void prune(long nowMs, long windowMs) {
        while (!timestamps.isEmpty() && nowMs - timestamps.peekFirst() > windowMs) {
            timestamps.pollFirst();
        }
    }

    void record(long nowMs) {
        timestamps.addLast(nowMs);
    }

    int size() {
        return timestamps.size();
    }

    boolean isEmpty() {
        return timestamps.isEmpty();
    }

    /** @return ältester Zeitstempel oder {@code -1} */
    long oldest() {
        Long first = timestamps.peekFirst();
        return first != null ? first : -1L;
    }
}

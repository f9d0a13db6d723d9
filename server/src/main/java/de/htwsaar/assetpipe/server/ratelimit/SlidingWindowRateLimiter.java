package de.htwsaar.assetpipe.server.ratelimit;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Rate-Limiter mit gleitendem Fenster pro Client-Schlüssel.
 *
 * <p>Prüfen und Eintragen laufen atomar pro Schlüssel innerhalb von
 * {@link ConcurrentHashMap#compute}; verschiedene Clients blockieren sich nicht gegenseitig.
 * Abgelehnte Versuche werden nicht gezählt.</p>
 */
public class SlidingWindowRateLimiter {

    /**
     * Ergebnis einer Prüfung.
     *
     * @param allowed      Request zulässig
     * @param retryAfterMs Wartezeit bis ein Platz im Fenster frei wird, {@code 0} wenn zulässig
     */
    public record Decision(boolean allowed, long retryAfterMs) {}

    private final ConcurrentHashMap<String, RateWindow> windows = new ConcurrentHashMap<>();
    private final int limit;
    private final long windowMs;

    /**
     * @param limit    maximale Requests pro Fenster; {@code 0} lehnt alles ab
     * @param windowMs Fensterlänge in Millisekunden
     */
    public SlidingWindowRateLimiter(int limit, long windowMs) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        if (windowMs <= 0) throw new IllegalArgumentException("windowMs must be > 0");
        this.limit = limit;
        this.windowMs = windowMs;
    }

    public boolean allow(String clientKey, long nowMs) {
        return check(clientKey, nowMs).allowed();
    }

    public Decision check(String clientKey, long nowMs) {
        String key = clientKey != null ? clientKey : "";
        Decision[] result = new Decision[1];
        windows.compute(key, (k, window) -> {
            RateWindow w = window != null ? window : new RateWindow();
            w.prune(nowMs, windowMs);
            if (w.size() >= limit) {
                long oldest = w.oldest();
                long retry = oldest >= 0 ? oldest + windowMs - nowMs + 1 : windowMs;
                result[0] = new Decision(false, Math.max(1, retry));
            } else {
                w.record(nowMs);
                result[0] = new Decision(true, 0);
            }
            return w;
        });
        return result[0];
    }

    /**
     * Entfernt Fenster ohne Zeitstempel im aktuellen Zeitraum.
     *
     * @param nowMs aktuelle Zeit
     * @return Anzahl entfernter Schlüssel
     */
    public int sweep(long nowMs) {
        int[] removed = new int[1];
        for (String key : windows.keySet()) {
            windows.computeIfPresent(key, (k, w) -> {
                w.prune(nowMs, windowMs);
                if (w.isEmpty()) {
                    removed[0]++;
                    return null;
                }
                return w;
            });
        }
        return removed[0];
    }

    public int trackedClients() {
        return windows.size();
    }
}

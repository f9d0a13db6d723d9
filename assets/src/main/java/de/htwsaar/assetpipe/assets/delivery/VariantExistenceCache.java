package de.htwsaar.assetpipe.assets.delivery;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cache für "gibt es das vorkomprimierte Geschwister?".
 *
 * <p>Schlüssel ist der Kandidatenpfad ({@code app.js.br}), Einträge verfallen nach der TTL.
 * Abgelaufene Einträge werden per {@link ConcurrentHashMap#compute} atomar pro Schlüssel neu
 * geprüft, sodass parallele Requests auf dieselbe Datei nur einen {@code stat} auslösen.</p>
 */
public class VariantExistenceCache {

    /** Standard-TTL: 5 Minuten. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);

    private record Entry(boolean exists, long checkedAtMs) {}

    private final ConcurrentHashMap<Path, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final long ttlMs;

    public VariantExistenceCache(Clock clock, Duration ttl) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ttlMs = Objects.requireNonNull(ttl, "ttl must not be null").toMillis();
    }

    public boolean exists(Path candidate) {
        long now = clock.millis();
        Entry entry = entries.compute(candidate, (path, current) -> {
            if (current != null && now - current.checkedAtMs() < ttlMs) {
                return current;
            }
            return new Entry(Files.isRegularFile(path), now);
        });
        return entry.exists();
    }

    public void invalidate(Path candidate) {
        entries.remove(candidate);
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}

package de.htwsaar.assetpipe.assets.delivery;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class VariantExistenceCacheTest {

    @TempDir
    Path dir;

    @Test
    void cachedAnswerHoldsUntilTtlExpires() throws IOException {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        VariantExistenceCache cache = new VariantExistenceCache(clock, Duration.ofMinutes(5));
        Path sibling = dir.resolve("app.js.br");

        assertFalse(cache.exists(sibling));

        Files.writeString(sibling, "x");
        clock.plusSeconds(60);
        assertFalse(cache.exists(sibling));

        clock.plusSeconds(240);
        assertTrue(cache.exists(sibling));
        assertEquals(1, cache.size());
    }

    @Test
    void invalidateForcesFreshCheck() throws IOException {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        VariantExistenceCache cache = new VariantExistenceCache(clock, Duration.ofMinutes(5));
        Path sibling = dir.resolve("site.css.gz");

        assertFalse(cache.exists(sibling));
        Files.writeString(sibling, "x");
        cache.invalidate(sibling);

        assertTrue(cache.exists(sibling));
    }

    @Test
    void directoriesDoNotCount() throws IOException {
        VariantExistenceCache cache = new VariantExistenceCache(Clock.systemUTC(), Duration.ofMinutes(5));
        Path directory = Files.createDirectory(dir.resolve("fake.br"));

        assertFalse(cache.exists(directory));
    }

    /** Verstellbare Uhr für TTL-Tests. */
    private static final class MutableClock extends Clock {
        private Instant current;

        private MutableClock(Instant start) {
            this.current = start;
        }

        void plusSeconds(long seconds) {
            current = current.plusSeconds(seconds);
        }

        @Override
        public ZoneId getZone() {
            return ZoneId.of("UTC");
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return current;
        }
    }
}

package de.htwsaar.assetpipe.server.ratelimit;

import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Räumt periodisch leere Client-Fenster aus dem {@link SlidingWindowRateLimiter}.
 */
public class RateLimiterSweeper {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterSweeper.class);

    private final SlidingWindowRateLimiter limiter;
    private final Clock clock;

    public RateLimiterSweeper(SlidingWindowRateLimiter limiter, Clock clock) {
        this.limiter = limiter;
        this.clock = clock;
    }

    @Scheduled(
            fixedDelayString = "${pipeline.rate-limit.sweep-interval-ms:60000}",
            initialDelayString = "${pipeline.rate-limit.sweep-interval-ms:60000}")
    public void sweep() {
        int removed = limiter.sweep(clock.millis());
        if (removed > 0) {
            log.atDebug()
                    .addKeyValue("removed", removed)
                    .addKeyValue("remaining", limiter.trackedClients())
                    .log("rate limiter sweep");
        }
    }
}

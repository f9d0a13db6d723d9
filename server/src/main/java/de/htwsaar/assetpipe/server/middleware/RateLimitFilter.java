package de.htwsaar.assetpipe.server.middleware;

import de.htwsaar.assetpipe.server.ratelimit.SlidingWindowRateLimiter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Begrenzt Requests pro Client-Adresse; bei Überschreitung {@code 429 Too Many Requests}
 * mit {@code Retry-After} in ganzen Sekunden.
 */
public class RateLimitFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String REJECTED_BODY = "Too Many Requests";

    private final SlidingWindowRateLimiter limiter;
    private final Clock clock;

    public RateLimitFilter(SlidingWindowRateLimiter limiter, Clock clock) {
        this.limiter = limiter;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String clientKey = request.getRemoteAddr();
        SlidingWindowRateLimiter.Decision decision = limiter.check(clientKey, clock.millis());
        if (decision.allowed()) {
            filterChain.doFilter(request, response);
            return;
        }

        long retryAfterSeconds = Math.max(1, (decision.retryAfterMs() + 999) / 1000);
        log.atDebug()
                .addKeyValue("ip", clientKey)
                .addKeyValue("retry_after_s", retryAfterSeconds)
                .log("rate limit exceeded");

        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds));
        PlainTextResponse.write(response, HttpStatus.TOO_MANY_REQUESTS.value(), REJECTED_BODY);
    }
}

package de.htwsaar.assetpipe.server.middleware;

import static org.junit.jupiter.api.Assertions.assertEquals;

import de.htwsaar.assetpipe.server.ratelimit.SlidingWindowRateLimiter;
import de.htwsaar.assetpipe.server.support.MutableClock;
import jakarta.servlet.ServletException;
import java.io.IOException;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RateLimitFilterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final RateLimitFilter filter = new RateLimitFilter(new SlidingWindowRateLimiter(3, 100), clock);

    @Test
    void fourthRequestInWindowIsRejectedAndWindowRecovers() throws ServletException, IOException {
        assertEquals(200, send("10.0.0.1").getStatus());
        assertEquals(200, send("10.0.0.1").getStatus());
        assertEquals(200, send("10.0.0.1").getStatus());

        MockHttpServletResponse rejected = send("10.0.0.1");
        assertEquals(429, rejected.getStatus());
        assertEquals("Too Many Requests", rejected.getContentAsString());
        assertEquals("1", rejected.getHeader("Retry-After"));

        clock.plusMillis(110);
        assertEquals(200, send("10.0.0.1").getStatus());
    }

    @Test
    void otherClientsAreNotAffected() throws ServletException, IOException {
        for (int i = 0; i < 3; i++) send("10.0.0.1");

        assertEquals(429, send("10.0.0.1").getStatus());
        assertEquals(200, send("10.0.0.2").getStatus());
    }

    private MockHttpServletResponse send(String ip) throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.setRemoteAddr(ip);
        MockHttpServletResponse response = new MockHttpServletResponse();
        filter.doFilter(request, response, (req, res) -> {});
        return response;
    }
}

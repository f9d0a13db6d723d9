package de.htwsaar.assetpipe.server.middleware;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jakarta.servlet.ServletException;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class HttpsRedirectFilterTest {

    private final HttpsRedirectFilter filter = new HttpsRedirectFilter();

    @Test
    void plainHttpIsRedirectedWithQuery() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/static/js/app.js");
        request.setServerName("example.org");
        request.setQueryString("v=1");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> {
            throw new AssertionError("chain must not run");
        });

        assertEquals(301, response.getStatus());
        assertEquals("https://example.org/static/js/app.js?v=1", response.getHeader("Location"));
    }

    @Test
    void secureRequestPassesThrough() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/");
        request.setSecure(true);
        AtomicBoolean called = new AtomicBoolean();

        filter.doFilter(request, new MockHttpServletResponse(), (req, res) -> called.set(true));

        assertTrue(called.get());
    }
}

package de.htwsaar.assetpipe.common.context;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class RequestContextTest {

    @Test
    void valuesAreWriteOnce() {
        MockHttpServletRequest request = new MockHttpServletRequest();

        RequestContext.bindCspNonce(request, "abc");

        assertEquals("abc", RequestContext.cspNonce(request).orElseThrow());
        assertThrows(IllegalStateException.class, () -> RequestContext.bindCspNonce(request, "other"));
        assertEquals("abc", RequestContext.cspNonce(request).orElseThrow());
    }

    @Test
    void missingValuesAreEmpty() {
        MockHttpServletRequest request = new MockHttpServletRequest();

        assertTrue(RequestContext.requestId(request).isEmpty());
        assertTrue(RequestContext.deadline(request).isEmpty());
        assertTrue(RequestContext.cspNonce(null).isEmpty());
    }

    @Test
    void deadlineReportsExpiryAndCancellation() {
        Clock fixed = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneId.of("UTC"));
        RequestDeadline deadline = RequestDeadline.after(fixed, Duration.ofSeconds(5));

        assertFalse(deadline.isDone());
        assertEquals(Duration.ofSeconds(5), deadline.remaining());

        deadline.cancel();
        assertTrue(deadline.isCancelled());
        assertTrue(deadline.isDone());

        RequestDeadline expired = RequestDeadline.after(fixed, Duration.ZERO);
        assertTrue(expired.isExpired());
        assertEquals(Duration.ZERO, expired.remaining());
    }
}

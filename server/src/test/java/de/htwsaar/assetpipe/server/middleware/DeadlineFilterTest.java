package de.htwsaar.assetpipe.server.middleware;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import de.htwsaar.assetpipe.common.context.RequestContext;
import de.htwsaar.assetpipe.common.context.RequestDeadline;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class DeadlineFilterTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        MDC.clear();
    }

    @Test
    void completedHandlerOutputIsCommitted() throws ServletException, IOException {
        DeadlineFilter filter = new DeadlineFilter(executor, Clock.systemUTC(), Duration.ofSeconds(5));
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/"), response, (req, res) -> {
            HttpServletResponse http = (HttpServletResponse) res;
            http.setStatus(201);
            http.setHeader("X-Handler", "done");
            http.getOutputStream().write("created".getBytes(StandardCharsets.UTF_8));
        });

        assertEquals(201, response.getStatus());
        assertEquals("done", response.getHeader("X-Handler"));
        assertEquals("created", response.getContentAsString());
    }

    @Test
    void slowHandlerGets408AndLateOutputIsDiscarded() throws Exception {
        DeadlineFilter filter = new DeadlineFilter(executor, Clock.systemUTC(), Duration.ofMillis(50));
        MockHttpServletResponse response = new MockHttpServletResponse();
        CountDownLatch workerDone = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        AtomicReference<RequestDeadline> seenDeadline = new AtomicReference<>();

        filter.doFilter(new MockHttpServletRequest("GET", "/slow"), response, (req, res) -> {
            seenDeadline.set(RequestContext.deadline(req).orElseThrow());
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                interrupted.set(true);
            }
            try {
                ((HttpServletResponse) res).setHeader("X-Late", "1");
                res.getOutputStream().write("late".getBytes(StandardCharsets.UTF_8));
            } finally {
                workerDone.countDown();
            }
        });

        assertEquals(408, response.getStatus());
        assertEquals("Request Timeout", response.getContentAsString());

        assertTrue(workerDone.await(5, TimeUnit.SECONDS));
        assertTrue(interrupted.get());
        assertTrue(seenDeadline.get().isCancelled());
        assertEquals("Request Timeout", response.getContentAsString());
        assertNull(response.getHeader("X-Late"));
    }

    @Test
    void failureAfterTimeoutIsLoggedAsWarningWithCause() throws Exception {
        Logger logger = (Logger) LoggerFactory.getLogger(DeadlineFilter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            DeadlineFilter filter = new DeadlineFilter(executor, Clock.systemUTC(), Duration.ofMillis(50));
            IllegalStateException late = new IllegalStateException("late failure");
            CountDownLatch release = new CountDownLatch(1);

            filter.doFilter(new MockHttpServletRequest("GET", "/late"), new MockHttpServletResponse(), (req, res) -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                throw late;
            });
            release.countDown();

            ILoggingEvent event = awaitEvent(appender, "handler failed after the request had timed out");
            assertEquals(Level.WARN, event.getLevel());
            assertNotNull(event.getThrowableProxy());
            assertEquals("late failure", event.getThrowableProxy().getMessage());
        } finally {
            logger.detachAppender(appender);
        }
    }

    @Test
    void handlerFailureIsRethrownToCaller() {
        DeadlineFilter filter = new DeadlineFilter(executor, Clock.systemUTC(), Duration.ofSeconds(5));
        IllegalStateException boom = new IllegalStateException("boom");

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> filter.doFilter(
                new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), (req, res) -> {
                    throw boom;
                }));

        assertSame(boom, thrown);
    }

    @Test
    void mdcIsPropagatedToWorker() throws ServletException, IOException {
        DeadlineFilter filter = new DeadlineFilter(executor, Clock.systemUTC(), Duration.ofSeconds(5));
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> thread = new AtomicReference<>();
        MDC.put("requestId", "abc123");

        filter.doFilter(new MockHttpServletRequest("GET", "/"), new MockHttpServletResponse(), (req, res) -> {
            seen.set(MDC.get("requestId"));
            thread.set(Thread.currentThread().getName());
        });

        assertEquals("abc123", seen.get());
        assertNotEquals(Thread.currentThread().getName(), thread.get());
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new DeadlineFilter(executor, Clock.systemUTC(), Duration.ZERO));
    }

    private static ILoggingEvent awaitEvent(ListAppender<ILoggingEvent> appender, String message)
            throws InterruptedException {
        long until = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < until) {
            synchronized (appender) {
                for (ILoggingEvent event : appender.list) {
                    if (message.equals(event.getMessage())) return event;
                }
            }
            Thread.sleep(10);
        }
        throw new AssertionError("no log event: " + message);
    }
}

package de.htwsaar.assetpipe.server.middleware;

import de.htwsaar.assetpipe.common.context.RequestContext;
import de.htwsaar.assetpipe.common.context.RequestDeadline;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Deadline-Guard: begrenzt die Laufzeit der inneren Kette.
 *
 * <p>Der innere Teil läuft auf einem Worker gegen eine {@link CapturedResponse}. Wer zuerst den
 * Zustand von {@code RUNNING} weg setzt, entscheidet über die Antwort: entweder wird der Puffer
 * vollständig übertragen oder der Client erhält {@code 408 Request Timeout}, nie beides.
 * Der Worker wird nach einem Timeout nur kooperativ abgebrochen (Interrupt und
 * {@link RequestDeadline#cancel()}); seine späteren Ausgaben landen im verworfenen Puffer.</p>
 */
public class DeadlineFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(DeadlineFilter.class);

    static final String TIMEOUT_BODY = "Request Timeout";

    enum State {
        RUNNING,
        COMPLETED,
        TIMED_OUT
    }

    private final ExecutorService executor;
    private final Clock clock;
    private final Duration timeout;

    public DeadlineFilter(ExecutorService executor, Clock clock, Duration timeout) {
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        this.executor = executor;
        this.clock = clock;
        this.timeout = timeout;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        RequestDeadline deadline = RequestDeadline.after(clock, timeout);
        RequestContext.bindDeadline(request, deadline);

        CapturedResponse captured = new CapturedResponse(response);
        AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        // nach einem Timeout darf der Worker den Request nicht mehr anfassen
        String method = request.getMethod();
        String path = request.getRequestURI();

        Future<?> worker = executor.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                filterChain.doFilter(request, captured);
            } catch (Throwable t) {
                failure.set(t);
            } finally {
                if (!state.compareAndSet(State.RUNNING, State.COMPLETED) && failure.get() != null) {
                    log.atWarn()
                            .addKeyValue("method", method)
                            .addKeyValue("path", path)
                            .setCause(failure.get())
                            .log("handler failed after the request had timed out");
                }
                done.countDown();
                MDC.clear();
            }
        });

        boolean interrupted = false;
        try {
            done.await(deadline.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            interrupted = true;
        }

        if (state.compareAndSet(State.RUNNING, State.TIMED_OUT)) {
            deadline.cancel();
            captured.discard();
            worker.cancel(true);
            log.atWarn()
                    .addKeyValue("method", method)
                    .addKeyValue("path", path)
                    .addKeyValue("timeout_ms", timeout.toMillis())
                    .log("request timed out");
            if (!response.isCommitted()) {
                PlainTextResponse.write(response, HttpStatus.REQUEST_TIMEOUT.value(), TIMEOUT_BODY);
            }
            if (interrupted) Thread.currentThread().interrupt();
            return;
        }

        // Worker hat gewonnen; seine Schreibzugriffe sind über den CAS sichtbar
        if (interrupted) Thread.currentThread().interrupt();
        Throwable t = failure.get();
        if (t != null) {
            rethrow(t);
        }
        captured.commitTo(response);
    }

    private static void rethrow(Throwable t) throws ServletException, IOException {
        if (t instanceof ServletException se) throw se;
        if (t instanceof IOException ioe) throw ioe;
        if (t instanceof RuntimeException re) throw re;
        if (t instanceof Error err) throw err;
        throw new ServletException(t);
    }
}

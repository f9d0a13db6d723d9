package de.htwsaar.assetpipe.server.middleware;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Fängt unerwartete Fehler aus allen inneren Schichten ab.
 *
 * <p>Ein Fehler in einem Handler darf nie den Server-Thread oder andere Requests beeinträchtigen:
 * er wird einmal mit Stacktrace geloggt und, falls die Antwort noch nicht committed ist, mit
 * einem schlichten {@code 500 Internal Server Error} beantwortet.</p>
 *
 * <p>Reine I/O-Fehler (z. B. abgebrochene Client-Verbindungen) werden unverändert
 * weitergereicht.</p>
 */
public class RecoveryFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RecoveryFilter.class);

    static final String ERROR_BODY = "Internal Server Error";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        try {
            filterChain.doFilter(request, response);
        } catch (RuntimeException | Error e) {
            recover(request, response, e);
        } catch (ServletException | IOException e) {
            if (!wrapsProgrammingError(e)) {
                throw e;
            }
            recover(request, response, e);
        }
    }

    private void recover(HttpServletRequest request, HttpServletResponse response, Throwable failure)
            throws IOException {

        log.atError()
                .setCause(failure)
                .addKeyValue("error", String.valueOf(rootCause(failure)))
                .addKeyValue("method", request.getMethod())
                .addKeyValue("path", request.getRequestURI())
                .addKeyValue("remote_addr", request.getRemoteAddr())
                .addKeyValue("user_agent", request.getHeader("User-Agent"))
                .log("panic recovered");

        if (response.isCommitted()) {
            return;
        }
        response.resetBuffer();
        PlainTextResponse.write(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, ERROR_BODY);
    }

    static boolean wrapsProgrammingError(Throwable e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof RuntimeException || cause instanceof Error) return true;
            if (cause.getCause() == cause) break;
            cause = cause.getCause();
        }
        return false;
    }

    private static Throwable rootCause(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }
}

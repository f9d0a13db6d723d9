package de.htwsaar.assetpipe.server.middleware;

import de.htwsaar.assetpipe.common.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Strukturierter Access-Log: ein Eintrag pro Request nach Abschluss.
 * Felder: method, path, status, duration_ms, ip, user_agent, request_id.
 */
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final int MAX_PATH_LENGTH = 100;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        long start = System.nanoTime();
        boolean failed = true;
        try {
            filterChain.doFilter(request, response);
            failed = false;
        } finally {
            int status = failed ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR : response.getStatus();
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            log.atLevel(status >= 500 ? Level.WARN : Level.INFO)
                    .addKeyValue("method", request.getMethod())
                    .addKeyValue("path", truncatePath(request.getRequestURI()))
                    .addKeyValue("status", status)
                    .addKeyValue("duration_ms", durationMs)
                    .addKeyValue("ip", request.getRemoteAddr())
                    .addKeyValue("user_agent", request.getHeader("User-Agent"))
                    .addKeyValue("request_id", RequestContext.requestId(request).orElse(""))
                    .log("request");
        }
    }

    static String truncatePath(String path) {
        if (path == null) return "";
        if (path.length() <= MAX_PATH_LENGTH) return path;
        return path.substring(0, MAX_PATH_LENGTH) + "...";
    }
}

package de.htwsaar.assetpipe.server.middleware;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Leitet unverschlüsselte Requests mit {@code 301} auf {@code https://} um.
 * Läuft nach dem Real-IP-Filter, damit {@code X-Forwarded-Proto} eines vertrauenswürdigen
 * Proxies berücksichtigt wird.
 */
public class HttpsRedirectFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (request.isSecure()) {
            filterChain.doFilter(request, response);
            return;
        }

        response.setStatus(HttpServletResponse.SC_MOVED_PERMANENTLY);
        response.setHeader(HttpHeaders.LOCATION, httpsLocation(request));
    }

    static String httpsLocation(HttpServletRequest request) {
        StringBuilder location = new StringBuilder("https://")
                .append(request.getServerName())
                .append(request.getRequestURI());
        String query = request.getQueryString();
        if (query != null && !query.isEmpty()) {
            location.append('?').append(query);
        }
        return location.toString();
    }
}

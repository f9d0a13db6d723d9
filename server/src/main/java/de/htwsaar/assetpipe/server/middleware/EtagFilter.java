package de.htwsaar.assetpipe.server.middleware;

import de.htwsaar.assetpipe.common.util.DigestUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Arrays;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

/**
 * Berechnet für GET-Antworten einen starken ETag über den (unkomprimierten) Body und beantwortet
 * passende {@code If-None-Match}-Requests mit {@code 304 Not Modified}.
 *
 * <p>Format: {@code "<16 Hex-Zeichen>"}, die ersten 8 Bytes des SHA-256 des Bodys.
 * Nur 2xx-Antworten mit nicht-leerem Body werden markiert; ein vom Handler gesetzter ETag
 * bleibt unverändert.</p>
 */
public class EtagFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!"GET".equals(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        filterChain.doFilter(request, wrapper);

        int status = wrapper.getStatus();
        byte[] body = wrapper.getContentAsByteArray();
        if (status >= 200 && status < 300 && body.length > 0 && !response.containsHeader(HttpHeaders.ETAG)) {
            String etag = computeEtag(body);
            response.setHeader(HttpHeaders.ETAG, etag);
            if (matches(request.getHeader(HttpHeaders.IF_NONE_MATCH), etag)) {
                response.setStatus(HttpServletResponse.SC_NOT_MODIFIED);
                return;
            }
        }
        wrapper.copyBodyToResponse();
    }

    static String computeEtag(byte[] body) {
        return "\"" + DigestUtil.toHex(Arrays.copyOf(DigestUtil.sha256(body), 8)) + "\"";
    }

    /**
     * Schwacher Vergleich nach RFC 9110: {@code W/} wird ignoriert, {@code *} passt immer.
     */
    static boolean matches(String ifNoneMatch, String etag) {
        if (ifNoneMatch == null || ifNoneMatch.isBlank()) return false;
        for (String candidate : ifNoneMatch.split(",")) {
            String c = candidate.trim();
            if (c.equals("*")) return true;
            if (c.startsWith("W/")) c = c.substring(2);
            if (c.equals(etag)) return true;
        }
        return false;
    }
}

package de.htwsaar.assetpipe.server.middleware;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletRequestWrapper;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.net.InetAddress;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Ermittelt die echte Client-Adresse hinter vertrauenswürdigen Proxies.
 *
 * <p>Weiterleitungs-Header werden nur ausgewertet, wenn die direkte Gegenstelle selbst ein
 * vertrauenswürdiger Proxy ist; sonst könnte jeder Client seine Adresse fälschen. Reihenfolge:
 * erster Eintrag von {@code X-Forwarded-For}, dann {@code X-Real-IP}, {@code X-Client-IP},
 * {@code CF-Connecting-IP}. Nur gültige IP-Literale werden übernommen.</p>
 *
 * <p>Nachgelagerte Filter sehen die Adresse über {@link HttpServletRequest#getRemoteAddr()}.
 * Ein von einem vertrauenswürdigen Proxy gesetztes {@code X-Forwarded-Proto: https} wird als
 * sichere Verbindung gemeldet.</p>
 */
public class RealIpFilter extends OncePerRequestFilter {

    static final List<String> CLIENT_IP_HEADERS =
            List.of("X-Forwarded-For", "X-Real-IP", "X-Client-IP", "CF-Connecting-IP");

    static final String FORWARDED_PROTO_HEADER = "X-Forwarded-Proto";

    private final TrustedProxies trustedProxies;

    public RealIpFilter(TrustedProxies trustedProxies) {
        this.trustedProxies = trustedProxies;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String peer = request.getRemoteAddr();
        if (!trustedProxies.contains(peer)) {
            filterChain.doFilter(request, response);
            return;
        }

        String clientIp = resolveForwardedIp(request).orElse(peer);
        String proto = request.getHeader(FORWARDED_PROTO_HEADER);
        String scheme = proto != null && !proto.isBlank() ? proto.trim().toLowerCase(Locale.ROOT) : null;
        filterChain.doFilter(new ForwardedRequest(request, clientIp, scheme), response);
    }

    static Optional<String> resolveForwardedIp(HttpServletRequest request) {
        for (String header : CLIENT_IP_HEADERS) {
            String value = request.getHeader(header);
            if (value == null || value.isBlank()) continue;
            String candidate = value;
            int comma = candidate.indexOf(',');
            if (comma >= 0) candidate = candidate.substring(0, comma);
            Optional<InetAddress> parsed = TrustedProxies.parseLiteral(candidate);
            if (parsed.isPresent()) {
                return Optional.of(parsed.get().getHostAddress());
            }
        }
        return Optional.empty();
    }

    /** Request-Sicht mit aufgelöster Client-Adresse. */
    static final class ForwardedRequest extends HttpServletRequestWrapper {

        private final String clientIp;
        private final String scheme;

        ForwardedRequest(HttpServletRequest request, String clientIp, String scheme) {
            super(request);
            this.clientIp = clientIp;
            this.scheme = scheme;
        }

        @Override
        public String getRemoteAddr() {
            return clientIp;
        }

        @Override
        public String getRemoteHost() {
            return clientIp;
        }

        @Override
        public String getScheme() {
            return scheme != null ? scheme : super.getScheme();
        }

        @Override
        public boolean isSecure() {
            return scheme != null ? "https".equals(scheme) : super.isSecure();
        }
    }
}

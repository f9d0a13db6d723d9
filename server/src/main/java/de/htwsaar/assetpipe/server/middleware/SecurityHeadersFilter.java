package de.htwsaar.assetpipe.server.middleware;

import de.htwsaar.assetpipe.common.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.security.SecureRandom;
import java.util.Base64;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Setzt Security-Header und erzeugt pro Request eine frische CSP-Nonce.
 * Die Nonce wird am Request gebunden, damit Templates sie in {@code <script nonce="...">}
 * einsetzen können.
 */
public class SecurityHeadersFilter extends OncePerRequestFilter {

    public static final String CONTENT_SECURITY_POLICY = "Content-Security-Policy";
    public static final String STRICT_TRANSPORT_SECURITY = "Strict-Transport-Security";

    static final String HSTS_VALUE = "max-age=31536000; includeSubDomains; preload";

    private static final int NONCE_BYTES = 16;

    private final SecureRandom random = new SecureRandom();
    private final boolean hstsEnabled;

    public SecurityHeadersFilter(boolean hstsEnabled) {
        this.hstsEnabled = hstsEnabled;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String nonce = generateNonce();
        RequestContext.bindCspNonce(request, nonce);

        response.setHeader(CONTENT_SECURITY_POLICY, contentSecurityPolicy(nonce));
        response.setHeader("X-Frame-Options", "DENY");
        response.setHeader("X-Content-Type-Options", "nosniff");
        response.setHeader("X-XSS-Protection", "1; mode=block");
        response.setHeader("Referrer-Policy", "strict-origin-when-cross-origin");
        response.setHeader("Permissions-Policy", "geolocation=(), microphone=(), camera=()");
        if (hstsEnabled && request.isSecure()) {
            response.setHeader(STRICT_TRANSPORT_SECURITY, HSTS_VALUE);
        }

        filterChain.doFilter(request, response);
    }

    static String contentSecurityPolicy(String nonce) {
        return "default-src 'self'; "
                + "script-src 'self' 'nonce-" + nonce + "'; "
                + "style-src 'self'; "
                + "img-src 'self' data:; "
                + "font-src 'self'; "
                + "object-src 'none'; "
                + "base-uri 'self'; "
                + "frame-ancestors 'none'";
    }

    String generateNonce() {
        byte[] bytes = new byte[NONCE_BYTES];
        random.nextBytes(bytes);
        return Base64.getEncoder().encodeToString(bytes);
    }
}

package de.htwsaar.assetpipe.common.logging;

import de.htwsaar.assetpipe.common.context.RequestContext;
import de.htwsaar.assetpipe.common.util.DigestUtil;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.security.SecureRandom;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet-Filter zur Vergabe einer Request-ID.
 * Für jede eingehende HTTP-Anfrage wird eine Request-ID aus dem Header übernommen oder neu
 * erzeugt, im Response-Header zurückgegeben, als Request-Attribut gebunden und im MDC
 * abgelegt, sodass sie automatisch in allen Logeinträgen enthalten ist.
 */
public class RequestIdFilter extends OncePerRequestFilter {

    /** Schlüsselname der Request-ID im Logging-Kontext */
    public static final String REQUEST_ID_KEY = "requestId";

    /** HTTP-Header, aus dem eine vorhandene Request-ID gelesen und in den sie geschrieben wird */
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    /** Längere oder nicht druckbare IDs vom Client werden verworfen (Log-Injection). */
    static final int MAX_INCOMING_LENGTH = 128;

    private final SecureRandom random = new SecureRandom();

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        // Request-ID aus Header lesen oder neu erzeugen
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (!isAcceptable(requestId)) {
            requestId = generateRequestId();
        }

        response.setHeader(REQUEST_ID_HEADER, requestId);
        RequestContext.bindRequestId(request, requestId);
        MDC.put(REQUEST_ID_KEY, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Wichtig: Kontext nach der Anfrage wieder entfernen
            MDC.remove(REQUEST_ID_KEY);
        }
    }

    /**
     * Erzeugt eine zufällige ID aus 8 Bytes (16 Hex-Zeichen).
     *
     * @return neue Request-ID
     */
    String generateRequestId() {
        byte[] bytes = new byte[8];
        random.nextBytes(bytes);
        return DigestUtil.toHex(bytes);
    }

    static boolean isAcceptable(String candidate) {
        if (candidate == null || candidate.isBlank() || candidate.length() > MAX_INCOMING_LENGTH) {
            return false;
        }
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (c < 0x21 || c > 0x7e) return false;
        }
        return true;
    }
}

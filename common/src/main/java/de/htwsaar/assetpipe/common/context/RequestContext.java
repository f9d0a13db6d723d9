package de.htwsaar.assetpipe.common.context;

import jakarta.servlet.ServletRequest;
import java.util.Objects;
import java.util.Optional;

/**
 * Request-gebundene Werte der Middleware-Kette.
 *
 * <p>Die Werte liegen als Request-Attribute am jeweiligen {@link ServletRequest}, nicht in
 * Thread-Locals, weil der Deadline-Guard den inneren Teil der Kette auf einem anderen Thread
 * ausführt. Jeder Wert darf pro Request genau einmal gesetzt werden.</p>
 */
public final class RequestContext {

    public static final String REQUEST_ID_ATTRIBUTE = RequestContext.class.getName() + ".requestId";
    public static final String CSP_NONCE_ATTRIBUTE = RequestContext.class.getName() + ".cspNonce";
    public static final String DEADLINE_ATTRIBUTE = RequestContext.class.getName() + ".deadline";

    private RequestContext() {}

    public static void bindRequestId(ServletRequest request, String requestId) {
        bindOnce(request, REQUEST_ID_ATTRIBUTE, requestId);
    }

    public static Optional<String> requestId(ServletRequest request) {
        return read(request, REQUEST_ID_ATTRIBUTE, String.class);
    }

    public static void bindCspNonce(ServletRequest request, String nonce) {
        bindOnce(request, CSP_NONCE_ATTRIBUTE, nonce);
    }

    public static Optional<String> cspNonce(ServletRequest request) {
        return read(request, CSP_NONCE_ATTRIBUTE, String.class);
    }

    public static void bindDeadline(ServletRequest request, RequestDeadline deadline) {
        bindOnce(request, DEADLINE_ATTRIBUTE, deadline);
    }

    public static Optional<RequestDeadline> deadline(ServletRequest request) {
        return read(request, DEADLINE_ATTRIBUTE, RequestDeadline.class);
    }

    private static void bindOnce(ServletRequest request, String name, Object value) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(value, name + " must not be null");
        if (request.getAttribute(name) != null) {
            throw new IllegalStateException("Request attribute already bound: " + name);
        }
        request.setAttribute(name, value);
    }

    private static <T> Optional<T> read(ServletRequest request, String name, Class<T> type) {
        if (request == null) return Optional.empty();
        Object value = request.getAttribute(name);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }
}

package de.htwsaar.assetpipe.server.middleware;

import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Kurze Klartext-Antworten der Middleware (429, 408, 500, ...).
 */
final class PlainTextResponse {

    static final String CONTENT_TYPE = "text/plain;charset=UTF-8";

    private PlainTextResponse() {}

    static void write(HttpServletResponse response, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        response.setStatus(status);
        response.setContentType(CONTENT_TYPE);
        response.setContentLength(bytes.length);
        response.getOutputStream().write(bytes);
    }
}

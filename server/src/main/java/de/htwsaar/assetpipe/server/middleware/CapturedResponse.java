package de.htwsaar.assetpipe.server.middleware;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

/**
 * Puffert Status, Header, Cookies und Body eines inneren Handlers.
 *
 * <p>Der Handler schreibt nie direkt auf die echte Antwort. {@link #commitTo} überträgt den Puffer
 * höchstens einmal; nach einem Timeout wird der Puffer verworfen.</p>
 */
public class CapturedResponse extends HttpServletResponseWrapper {

    private final HttpHeaders headers = new HttpHeaders();
    private final List<Cookie> cookies = new ArrayList<>();
    private final ByteArrayOutputStream body = new ByteArrayOutputStream();
    private final AtomicBoolean committed = new AtomicBoolean();

    private int status = HttpServletResponse.SC_OK;
    private boolean errorSent;
    private String characterEncoding;
    private ServletOutputStream outputStream;
    private PrintWriter writer;

    public CapturedResponse(HttpServletResponse response) {
        super(response);
    }

    // --- Status ---

    @Override
    public void setStatus(int sc) {
        if (errorSent) return;
        this.status = sc;
    }

    @Override
    public int getStatus() {
        return status;
    }

    /** Die Meldung wird nicht an den Client gegeben; es zählt nur der Status. */
    @Override
    public void sendError(int sc, String msg) {
        checkNotSent();
        this.status = sc;
        this.errorSent = true;
        body.reset();
    }

    @Override
    public void sendError(int sc) {
        sendError(sc, null);
    }

    @Override
    public void sendRedirect(String location) {
        checkNotSent();
        this.status = HttpServletResponse.SC_FOUND;
        headers.set(HttpHeaders.LOCATION, location);
        this.errorSent = true;
    }

    // --- Header ---

    @Override
    public void setHeader(String name, String value) {
        if (value == null) {
            headers.remove(name);
        } else {
            headers.set(name, value);
        }
    }

    @Override
    public void addHeader(String name, String value) {
        if (value != null) headers.add(name, value);
    }

    @Override
    public void setIntHeader(String name, int value) {
        setHeader(name, Integer.toString(value));
    }

    @Override
    public void addIntHeader(String name, int value) {
        addHeader(name, Integer.toString(value));
    }

    @Override
    public void setDateHeader(String name, long date) {
        headers.setDate(name, date);
    }

    @Override
    public void addDateHeader(String name, long date) {
        addHeader(name, DateTimeFormatter.RFC_1123_DATE_TIME.format(
                ZonedDateTime.ofInstant(Instant.ofEpochMilli(date), ZoneOffset.UTC)));
    }

    @Override
    public boolean containsHeader(String name) {
        return headers.containsKey(name);
    }

    @Override
    public String getHeader(String name) {
        return headers.getFirst(name);
    }

    @Override
    public Collection<String> getHeaders(String name) {
        List<String> values = headers.get(name);
        return values != null ? List.copyOf(values) : List.of();
    }

    @Override
    public Collection<String> getHeaderNames() {
        return List.copyOf(headers.keySet());
    }

    @Override
    public void addCookie(Cookie cookie) {
        cookies.add(cookie);
    }

    @Override
    public void setContentType(String type) {
        if (type == null) {
            headers.remove(HttpHeaders.CONTENT_TYPE);
            return;
        }
        MediaType mediaType = MediaType.parseMediaType(type);
        if (mediaType.getCharset() != null) {
            characterEncoding = mediaType.getCharset().name();
        } else if (characterEncoding != null && mediaType.getType().equals("text")) {
            type = type + ";charset=" + characterEncoding;
        }
        headers.set(HttpHeaders.CONTENT_TYPE, type);
    }

    @Override
    public String getContentType() {
        return headers.getFirst(HttpHeaders.CONTENT_TYPE);
    }

    @Override
    public void setCharacterEncoding(String charset) {
        if (writer != null) return;
        this.characterEncoding = charset;
        String current = getContentType();
        if (current != null && charset != null) {
            MediaType mediaType = MediaType.parseMediaType(current);
            headers.set(HttpHeaders.CONTENT_TYPE,
                    new MediaType(mediaType, Charset.forName(charset)).toString());
        }
    }

    @Override
    public String getCharacterEncoding() {
        return characterEncoding != null ? characterEncoding : StandardCharsets.ISO_8859_1.name();
    }

    @Override
    public void setContentLength(int len) {
        setContentLengthLong(len);
    }

    @Override
    public void setContentLengthLong(long len) {
        headers.setContentLength(len);
    }

    @Override
    public void setLocale(Locale loc) {
        if (loc != null) headers.set(HttpHeaders.CONTENT_LANGUAGE, loc.toLanguageTag());
    }

    // --- Body ---

    @Override
    public ServletOutputStream getOutputStream() {
        if (writer != null) {
            throw new IllegalStateException("getWriter() has already been called");
        }
        if (outputStream == null) {
            outputStream = new BufferOutputStream();
        }
        return outputStream;
    }

    @Override
    public PrintWriter getWriter() {
        if (outputStream != null) {
            throw new IllegalStateException("getOutputStream() has already been called");
        }
        if (writer == null) {
            writer = new PrintWriter(new OutputStreamWriter(body, Charset.forName(getCharacterEncoding())));
        }
        return writer;
    }

    @Override
    public void flushBuffer() {
        if (writer != null) writer.flush();
    }

    @Override
    public void resetBuffer() {
        if (writer != null) writer.flush();
        body.reset();
    }

    @Override
    public void reset() {
        resetBuffer();
        headers.clear();
        cookies.clear();
        status = HttpServletResponse.SC_OK;
        errorSent = false;
    }

    @Override
    public boolean isCommitted() {
        return errorSent;
    }

    @Override
    public int getBufferSize() {
        return Integer.MAX_VALUE;
    }

    @Override
    public void setBufferSize(int size) {
        // gepuffert wird ohnehin alles
    }

    /** @return bisher geschriebener Body */
    public byte[] getBody() {
        if (writer != null) writer.flush();
        return body.toByteArray();
    }

    /**
     * Überträgt den gepufferten Zustand auf die echte Antwort. Nur der erste Aufruf wirkt.
     *
     * @param target echte Antwort
     * @return {@code true}, wenn dieser Aufruf übertragen hat
     * @throws IOException bei Schreibfehlern
     */
    public boolean commitTo(HttpServletResponse target) throws IOException {
        if (!committed.compareAndSet(false, true)) {
            return false;
        }

        target.setStatus(status);
        for (Map.Entry<String, List<String>> header : headers.entrySet()) {
            for (String value : header.getValue()) {
                target.addHeader(header.getKey(), value);
            }
        }
        for (Cookie cookie : cookies) {
            target.addCookie(cookie);
        }

        if (errorSent && status >= 400) {
            HttpStatus resolved = HttpStatus.resolve(status);
            PlainTextResponse.write(target, status, resolved != null ? resolved.getReasonPhrase() : "Error");
            return true;
        }

        byte[] bytes = getBody();
        if (bytes.length > 0) {
            target.getOutputStream().write(bytes);
        }
        return true;
    }

    private void checkNotSent() {
        if (errorSent) {
            throw new IllegalStateException("Response has already been committed");
        }
    }

    private void checkOpen() {
        if (committed.get()) {
            throw new IllegalStateException("Captured response has already been committed or discarded");
        }
    }

    /** Markiert den Puffer als verworfen; spätere Schreibversuche schlagen fehl. */
    void discard() {
        committed.set(true);
    }

    private final class BufferOutputStream extends ServletOutputStream {

        @Override
        public void write(int b) {
            checkOpen();
            body.write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) {
            checkOpen();
            body.write(b, off, len);
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setWriteListener(WriteListener writeListener) {
            throw new UnsupportedOperationException("Async writes are not supported on a captured response");
        }
    }
}

package de.htwsaar.assetpipe.server.middleware;

import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.Charset;
import java.util.zip.GZIPOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;

/**
 * Response-Wrapper, der beim ersten Schreibzugriff zwischen gzip und Durchreichen entscheidet.
 * {@code Content-Length} wird bis zur Entscheidung zurückgehalten und bei Kompression verworfen.
 */
class CompressingResponseWrapper extends HttpServletResponseWrapper {

    private static final Logger log = LoggerFactory.getLogger(CompressingResponseWrapper.class);

    private static final int BUFFER_SIZE = 8192;

    private final int level;
    private final CompressionFilter policy;

    private Boolean compressing;
    private long pendingContentLength = -1;
    private OutputStream target;
    private GZIPOutputStream gzip;
    private ServletOutputStream stream;
    private PrintWriter writer;
    private boolean finished;

    CompressingResponseWrapper(HttpServletResponse response, int level, CompressionFilter policy) {
        super(response);
        this.level = level;
        this.policy = policy;
    }

    @Override
    public void setContentLength(int len) {
        setContentLengthLong(len);
    }

    @Override
    public void setContentLengthLong(long len) {
        if (compressing == null) {
            pendingContentLength = len;
        } else if (!compressing) {
            super.setContentLengthLong(len);
        }
    }

    @Override
    public void setHeader(String name, String value) {
        if (HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name)) {
            if (value != null) setContentLengthLong(Long.parseLong(value.trim()));
            return;
        }
        super.setHeader(name, value);
    }

    @Override
    public void addHeader(String name, String value) {
        if (HttpHeaders.CONTENT_LENGTH.equalsIgnoreCase(name)) {
            setHeader(name, value);
            return;
        }
        super.addHeader(name, value);
    }

    @Override
    public ServletOutputStream getOutputStream() {
        if (writer != null) {
            throw new IllegalStateException("getWriter() has already been called");
        }
        if (stream == null) {
            stream = new DecidingOutputStream();
        }
        return stream;
    }

    @Override
    public PrintWriter getWriter() {
        if (stream != null) {
            throw new IllegalStateException("getOutputStream() has already been called");
        }
        if (writer == null) {
            writer = new PrintWriter(new OutputStreamWriter(
                    new DecidingOutputStream(), Charset.forName(getCharacterEncoding())));
        }
        return writer;
    }

    @Override
    public void flushBuffer() throws IOException {
        if (writer != null) writer.flush();
        if (gzip != null) gzip.flush();
        super.flushBuffer();
    }

    @Override
    public void resetBuffer() {
        if (compressing != null) {
            throw new IllegalStateException("Cannot reset buffer after compression has started");
        }
        super.resetBuffer();
    }

    /** Schließt den gzip-Stream ab; idempotent. */
    void finish() throws IOException {
        if (finished) return;
        finished = true;
        if (writer != null) writer.flush();
        if (compressing == null) {
            compressing = false;
            if (pendingContentLength >= 0) super.setContentLengthLong(pendingContentLength);
            return;
        }
        if (gzip != null) gzip.finish();
    }

    private OutputStream target() throws IOException {
        if (compressing == null) decide();
        return target;
    }

    private void decide() throws IOException {
        HttpServletResponse response = (HttpServletResponse) getResponse();
        int status = getStatus();
        boolean eligible = status >= 200
                && status != HttpServletResponse.SC_NO_CONTENT
                && status != HttpServletResponse.SC_NOT_MODIFIED
                && getHeader(HttpHeaders.CONTENT_ENCODING) == null
                && policy.isCompressible(getContentType());

        if (eligible) {
            try {
                gzip = new GZIPOutputStream(response.getOutputStream(), BUFFER_SIZE, true) {
                    {
                        def.setLevel(level);
                    }
                };
                compressing = true;
                target = gzip;
                super.setHeader(HttpHeaders.CONTENT_ENCODING, "gzip");
                addVaryAcceptEncoding();
                return;
            } catch (IOException e) {
                log.atWarn().setCause(e).log("gzip writer could not be created, sending uncompressed");
                gzip = null;
            }
        }

        compressing = false;
        if (pendingContentLength >= 0) super.setContentLengthLong(pendingContentLength);
        target = response.getOutputStream();
    }

    private void addVaryAcceptEncoding() {
        for (String vary : getHeaders(HttpHeaders.VARY)) {
            for (String token : vary.split(",")) {
                String t = token.trim();
                if (t.equalsIgnoreCase(HttpHeaders.ACCEPT_ENCODING) || t.equals("*")) return;
            }
        }
        super.addHeader(HttpHeaders.VARY, HttpHeaders.ACCEPT_ENCODING);
    }

    private final class DecidingOutputStream extends ServletOutputStream {

        @Override
        public void write(int b) throws IOException {
            target().write(b);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (len == 0) return;
            target().write(b, off, len);
        }

        @Override
        public void flush() throws IOException {
            if (compressing != null) target.flush();
        }

        @Override
        public void close() throws IOException {
            finish();
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setWriteListener(WriteListener writeListener) {
            throw new UnsupportedOperationException("Async writes are not supported while compressing");
        }
    }
}

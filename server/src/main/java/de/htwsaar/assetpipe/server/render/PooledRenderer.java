package de.htwsaar.assetpipe.server.render;

import de.htwsaar.assetpipe.assets.manifest.AssetUrlResolver;
import de.htwsaar.assetpipe.common.context.RequestContext;
import de.htwsaar.assetpipe.common.serialization.JacksonCodec;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;

/**
 * Rendert vollständig in einen Puffer aus dem {@link BufferPool} und schreibt Status, Header und
 * Body erst danach in einem Zug. Schlägt das Rendern fehl, wird der Puffer verworfen und ein
 * schlichtes {@code 500} gesendet; eine halb geschriebene Seite erreicht den Client nie.
 */
public class PooledRenderer {

    private static final Logger log = LoggerFactory.getLogger(PooledRenderer.class);

    public static final String HTML_CONTENT_TYPE = "text/html; charset=utf-8";

    /** Schreibt den Body in den Puffer. */
    @FunctionalInterface
    public interface BodyWriter {
        void writeTo(OutputStream out) throws IOException;
    }

    private final BufferPool pool;
    private final AssetUrlResolver assets;

    public PooledRenderer(BufferPool pool, AssetUrlResolver assets) {
        this.pool = pool;
        this.assets = assets;
    }

    public void render(HttpServletResponse response, int status, String contentType, BodyWriter body)
            throws IOException {

        RenderBuffer buffer = pool.acquire();
        try {
            try {
                body.writeTo(buffer);
            } catch (IOException | RuntimeException e) {
                renderFailed(response, e);
                return;
            }
            response.setStatus(status);
            response.setContentType(contentType);
            response.setContentLength(buffer.size());
            buffer.writeTo(response.getOutputStream());
        } finally {
            pool.release(buffer);
        }
    }

    public void json(HttpServletResponse response, int status, Object model) throws IOException {
        render(response, status, MediaType.APPLICATION_JSON_VALUE, out -> JacksonCodec.writeJson(model, out));
    }

    public void html(HttpServletRequest request, HttpServletResponse response, HtmlView view) throws IOException {
        ViewContext context = new ViewContext(
                RequestContext.cspNonce(request).orElse(""),
                RequestContext.requestId(request).orElse(""),
                assets);
        render(response, HttpServletResponse.SC_OK, HTML_CONTENT_TYPE, out -> {
            Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
            view.render(context, writer);
            writer.flush();
        });
    }

    private void renderFailed(HttpServletResponse response, Exception cause) throws IOException {
        log.atError().setCause(cause).log("render failed");
        if (response.isCommitted()) {
            throw new RenderException("Render failed after the response was committed", cause);
        }
        response.resetBuffer();
        byte[] bytes = "Internal Server Error".getBytes(StandardCharsets.UTF_8);
        response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
        response.setContentType("text/plain;charset=UTF-8");
        response.setContentLength(bytes.length);
        response.getOutputStream().write(bytes);
    }
}

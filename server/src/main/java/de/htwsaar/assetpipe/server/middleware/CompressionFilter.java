package de.htwsaar.assetpipe.server.middleware;

import de.htwsaar.assetpipe.assets.delivery.AcceptEncoding;
import de.htwsaar.assetpipe.assets.delivery.ContentEncoding;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.zip.Deflater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Streamende gzip-Kompression für Clients mit {@code Accept-Encoding: gzip}.
 *
 * <p>Ob komprimiert wird, entscheidet sich beim ersten geschriebenen Byte anhand von Status,
 * Content-Type (exakt oder per Präfix in der Allow-List) und einem bereits gesetzten
 * {@code Content-Encoding}. Ein ungültiger Kompressionslevel schaltet die Kompression ab.</p>
 */
public class CompressionFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(CompressionFilter.class);

    public static final List<String> DEFAULT_CONTENT_TYPES = List.of(
            "text/html",
            "text/css",
            "text/plain",
            "text/javascript",
            "application/javascript",
            "application/json",
            "application/xml",
            "image/svg+xml");

    private final int level;
    private final List<String> contentTypes;
    private final boolean enabled;

    public CompressionFilter(int level, List<String> contentTypes) {
        this.level = level;
        this.contentTypes = contentTypes.stream()
                .map(t -> t.trim().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .toList();
        this.enabled = isValidLevel(level);
        if (!enabled) {
            log.atWarn()
                    .addKeyValue("level", level)
                    .log("invalid gzip compression level, responses will not be compressed");
        }
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!enabled
                || "HEAD".equals(request.getMethod())
                || !AcceptEncoding.parse(request.getHeader(HttpHeaders.ACCEPT_ENCODING)).accepts(ContentEncoding.GZIP)) {
            filterChain.doFilter(request, response);
            return;
        }

        CompressingResponseWrapper wrapper = new CompressingResponseWrapper(response, level, this);
        try {
            filterChain.doFilter(request, wrapper);
        } finally {
            wrapper.finish();
        }
    }

    boolean isCompressible(String contentType) {
        if (contentType == null || contentType.isBlank()) return false;
        String type = contentType.toLowerCase(Locale.ROOT);
        int semicolon = type.indexOf(';');
        if (semicolon >= 0) type = type.substring(0, semicolon);
        type = type.trim();
        for (String allowed : contentTypes) {
            if (type.equals(allowed) || type.startsWith(allowed)) return true;
        }
        return false;
    }

    boolean isEnabled() {
        return enabled;
    }

    static boolean isValidLevel(int level) {
        return level == Deflater.DEFAULT_COMPRESSION
                || (level >= Deflater.BEST_SPEED && level <= Deflater.BEST_COMPRESSION);
    }
}

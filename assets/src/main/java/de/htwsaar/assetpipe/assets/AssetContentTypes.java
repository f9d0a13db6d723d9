package de.htwsaar.assetpipe.assets;

import java.util.Locale;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.http.MediaTypeFactory;

/**
 * Content-Type-Ermittlung über die Dateiendung.
 *
 * <p>Für die typischen Web-Assets gibt es feste Zuordnungen, alles andere geht über
 * {@link MediaTypeFactory}. Unbekannte Endungen werden zu {@code application/octet-stream}.</p>
 */
public final class AssetContentTypes {

    private static final Map<String, String> WEB_TYPES = Map.ofEntries(
            Map.entry("js", "text/javascript"),
            Map.entry("mjs", "text/javascript"),
            Map.entry("css", "text/css"),
            Map.entry("html", "text/html"),
            Map.entry("htm", "text/html"),
            Map.entry("svg", "image/svg+xml"),
            Map.entry("json", "application/json"),
            Map.entry("map", "application/json"),
            Map.entry("wasm", "application/wasm"),
            Map.entry("txt", "text/plain"),
            Map.entry("xml", "application/xml"),
            Map.entry("woff2", "font/woff2"),
            Map.entry("woff", "font/woff"));

    private AssetContentTypes() {}

    /**
     * @param fileName Dateiname oder Pfad; entscheidend ist nur die letzte Endung
     * @return MIME-Type als String, nie {@code null}
     */
    public static String forName(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM_VALUE;
        }
        int slash = fileName.lastIndexOf('/');
        String name = slash >= 0 ? fileName.substring(slash + 1) : fileName;
        int dot = name.lastIndexOf('.');
        if (dot >= 0) {
            String known = WEB_TYPES.get(name.substring(dot + 1).toLowerCase(Locale.ROOT));
            if (known != null) return known;
        }
        return MediaTypeFactory.getMediaType(name)
                .map(MediaType::toString)
                .orElse(MediaType.APPLICATION_OCTET_STREAM_VALUE);
    }
}

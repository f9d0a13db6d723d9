package de.htwsaar.assetpipe.server.web;

import de.htwsaar.assetpipe.assets.delivery.PrecompressedAssetResolver;
import de.htwsaar.assetpipe.assets.delivery.ResolvedAsset;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UrlPathHelper;

/**
 * Liefert statische Assets unter dem konfigurierten Präfix aus.
 *
 * <p>GET und HEAD wählen per {@code Accept-Encoding} zwischen {@code .br}, {@code .gz} und dem
 * Original. Komprimierte Varianten und über die versionierte URL angefragte Dateien bekommen
 * {@code Cache-Control: public, max-age=31536000, immutable}. {@code Vary: Accept-Encoding} wird
 * immer gesetzt.</p>
 */
@RestController
public class StaticAssetController {

    static final String IMMUTABLE_CACHE_CONTROL = "public, max-age=31536000, immutable";

    private final PrecompressedAssetResolver resolver;
    private final UrlPathHelper urlPathHelper = UrlPathHelper.defaultInstance;

    public StaticAssetController(PrecompressedAssetResolver resolver) {
        this.resolver = resolver;
    }

    // HEAD wird von Spring über das GET-Mapping bedient
    @GetMapping("${assets.url-prefix:/static}/**")
    public ResponseEntity<?> get(
            HttpServletRequest request,
            @RequestHeader(value = HttpHeaders.ACCEPT_ENCODING, required = false) String acceptEncoding) {

        return toResponse(resolver.resolve(path(request), acceptEncoding));
    }

    @RequestMapping(
            value = "${assets.url-prefix:/static}/**",
            method = {RequestMethod.POST, RequestMethod.PUT, RequestMethod.PATCH, RequestMethod.DELETE})
    public ResponseEntity<?> other(HttpServletRequest request) {
        return toResponse(resolver.resolveOriginal(path(request)));
    }

    private String path(HttpServletRequest request) {
        return urlPathHelper.getPathWithinApplication(request);
    }

    private ResponseEntity<?> toResponse(Optional<ResolvedAsset> resolved) {
        if (resolved.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .header(HttpHeaders.VARY, HttpHeaders.ACCEPT_ENCODING)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body("404 page not found");
        }

        ResolvedAsset asset = resolved.get();
        ResponseEntity.BodyBuilder builder = ResponseEntity.ok()
                .header(HttpHeaders.VARY, HttpHeaders.ACCEPT_ENCODING)
                .contentType(MediaType.parseMediaType(asset.contentType()));
        if (asset.isCompressed()) {
            builder.header(HttpHeaders.CONTENT_ENCODING, asset.encoding().token());
        }
        if (asset.isImmutable()) {
            builder.header(HttpHeaders.CACHE_CONTROL, IMMUTABLE_CACHE_CONTROL);
        }
        return builder.body(new FileSystemResource(asset.file()));
    }
}

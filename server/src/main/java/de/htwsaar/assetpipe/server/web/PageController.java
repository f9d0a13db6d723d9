package de.htwsaar.assetpipe.server.web;

import de.htwsaar.assetpipe.assets.manifest.AssetManifest;
import de.htwsaar.assetpipe.assets.manifest.ManifestFile;
import de.htwsaar.assetpipe.server.render.PooledRenderer;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;

/**
 * Beispiel-Seiten, gerendert über den {@link PooledRenderer}.
 */
@Controller
public class PageController {

    private final PooledRenderer renderer;
    private final AssetManifest manifest;
    private final IndexView indexView;

    public PageController(
            PooledRenderer renderer,
            AssetManifest manifest,
            @Value("${pages.index.stylesheet:static/css/site.css}") String stylesheet,
            @Value("${pages.index.script:static/js/app.js}") String script) {
        this.renderer = renderer;
        this.manifest = manifest;
        this.indexView = new IndexView(stylesheet, script);
    }

    @GetMapping("/")
    public void index(HttpServletRequest request, HttpServletResponse response) throws IOException {
        renderer.html(request, response, indexView);
    }

    /** Aktuelles Manifest im {@code manifest.json}-Format. */
    @GetMapping("/api/assets/manifest")
    public void manifest(HttpServletResponse response) throws IOException {
        renderer.json(response, HttpServletResponse.SC_OK, ManifestFile.toDocument(manifest));
    }
}

package de.htwsaar.assetpipe.cli.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import de.htwsaar.assetpipe.assets.manifest.AssetManifest;
import de.htwsaar.assetpipe.assets.manifest.AssetRecord;
import de.htwsaar.assetpipe.assets.manifest.ManifestFile;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestServiceTest {

    @TempDir
    Path src;

    @Test
    void writesManifestThatLoadsAgain() throws IOException {
        write("js/app.js", "alert(1)");
        write("css/site.css", "body{}");
        Path out = src.resolve("manifest.json");

        ManifestSummary summary = new ManifestService("/static", 0).generate(src, out, false);

        assertEquals(2, summary.assets());
        assertEquals(0, summary.versionedCopies());
        AssetManifest loaded = ManifestFile.read(out);
        AssetRecord app = loaded.lookup("static/js/app.js").orElseThrow();
        assertEquals("/static/js/app.6e11c72f.js", app.versionedPath());
        assertEquals("text/javascript", app.contentType());
    }

    @Test
    void writesVersionedCopiesOnce() throws IOException {
        write("js/app.js", "alert(1)");
        Path out = src.resolve("manifest.json");
        ManifestService service = new ManifestService("/static", 0);

        ManifestSummary first = service.generate(src, out, true);
        ManifestSummary second = service.generate(src, out, true);

        assertEquals(1, first.versionedCopies());
        assertEquals("alert(1)", Files.readString(src.resolve("js/app.6e11c72f.js")));
        assertEquals(1, second.assets());
        assertEquals(0, second.versionedCopies());
    }

    @Test
    void emptyDirectoryWritesNothing() throws IOException {
        Path out = src.resolve("manifest.json");

        ManifestSummary summary = new ManifestService("/static", 0).generate(src, out, false);

        assertEquals(0, summary.assets());
        assertNull(summary.manifestFile());
        assertFalse(Files.exists(out));
    }

    @Test
    void emptyPrefixMapsUrlsStraightToFiles() throws IOException {
        write("app.js", "alert(1)");
        Path out = src.resolve("out/manifest.json");

        ManifestService service = new ManifestService("/", 0);
        service.generate(src, out, true);

        assertTrue(Files.exists(out));
        assertTrue(Files.exists(src.resolve("app.6e11c72f.js")));
        assertEquals("js/app.js", service.toFileKey("/js/app.js"));
    }

    private void write(String relative, String content) throws IOException {
        Path file = src.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}

package de.htwsaar.assetpipe.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.htwsaar.assetpipe.assets.manifest.AssetManifest;
import de.htwsaar.assetpipe.assets.manifest.AssetManifestException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** Startverhalten der Manifest-Bean: leeres oder fehlendes Manifest bricht ab. */
class ServerBeansTest {

    private static final long MAX_SIZE = 10L * 1024 * 1024;

    @TempDir
    Path root;

    private final ServerBeans beans = new ServerBeans();

    @Test
    void emptyAssetRootAbortsStartup() {
        assertThrows(
                AssetManifestException.class,
                () -> beans.assetManifest(root.toString(), "/static", "build", "", MAX_SIZE));
    }

    @Test
    void rootWithOnlySkippedFilesIsEmptyToo() throws IOException {
        Files.writeString(root.resolve("app.js.br"), "x");
        Files.writeString(root.resolve(".hidden"), "x");

        assertThrows(
                AssetManifestException.class,
                () -> beans.assetManifest(root.toString(), "/static", "build", "", MAX_SIZE));
    }

    @Test
    void missingManifestFileAbortsStartup() {
        assertThrows(
                AssetManifestException.class,
                () -> beans.assetManifest(root.toString(), "/static", "file", "", MAX_SIZE));
    }

    @Test
    void populatedRootBuildsManifest() throws IOException {
        Files.createDirectories(root.resolve("js"));
        Files.writeString(root.resolve("js/app.js"), "alert(1)");

        AssetManifest manifest = beans.assetManifest(root.toString(), "/static", "build", "", MAX_SIZE);

        assertEquals(1, manifest.size());
        assertEquals("/static/js/app.6e11c72f.js", manifest.lookup("static/js/app.js").orElseThrow().versionedPath());
    }
}

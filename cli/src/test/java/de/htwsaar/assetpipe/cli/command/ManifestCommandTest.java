package de.htwsaar.assetpipe.cli.command;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManifestCommandTest {

    @TempDir
    Path src;

    private final CommandTestSupport cli = new CommandTestSupport();

    @Test
    void defaultOutputLandsInSourceDirectory() throws IOException {
        Files.createDirectories(src.resolve("css"));
        Files.writeString(src.resolve("css/site.css"), "body{}");

        int rc = cli.execute("manifest", "--src", src.toString());

        assertEquals(0, rc);
        String json = Files.readString(src.resolve("manifest.json"));
        assertTrue(json.contains("\"static/css/site.css\""));
        assertTrue(json.contains("/static/css/site.7c98040a.css"));
        assertTrue(cli.out.toString().contains("assets=1"));
    }

    @Test
    void customPrefixAndVersionedCopies() throws IOException {
        Files.writeString(src.resolve("app.js"), "alert(1)");
        Path out = src.resolve("build/manifest.json");

        int rc = cli.execute(
                "manifest", "--src", src.toString(), "--out", out.toString(), "--prefix", "/assets", "--write-versioned");

        assertEquals(0, rc);
        assertTrue(Files.readString(out).contains("/assets/app.6e11c72f.js"));
        assertTrue(Files.exists(src.resolve("app.6e11c72f.js")));
    }

    @Test
    void emptyDirectoryExitsWithTwo() {
        int rc = cli.execute("manifest", "--src", src.toString());

        assertEquals(2, rc);
        assertFalse(Files.exists(src.resolve("manifest.json")));
    }

    @Test
    void missingDirectoryExitsWithOne() {
        int rc = cli.execute("manifest", "--src", src.resolve("missing").toString());

        assertEquals(1, rc);
        assertTrue(cli.err.toString().contains("Failed"));
    }
}

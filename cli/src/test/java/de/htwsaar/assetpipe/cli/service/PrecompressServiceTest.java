package de.htwsaar.assetpipe.cli.service;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PrecompressServiceTest {

    @TempDir
    Path src;

    private final PrecompressService service = new PrecompressService(List.of(new GzipVariantEncoder(9)));

    @Test
    void compressesOnlyTextLikeAssets() throws IOException {
        write("js/app.js", "console.log('hello hello hello');");
        write("css/site.css", "body{margin:0}");
        write("img/logo.png", "not really a png");
        write("js/old.js.gz", "stale");

        PrecompressResult result = service.run(src);

        assertEquals(2, result.scanned());
        assertEquals(2, result.gzip());
        assertEquals(0, result.brotli());
        assertTrue(Files.exists(src.resolve("js/app.js.gz")));
        assertTrue(Files.exists(src.resolve("css/site.css.gz")));
        assertFalse(Files.exists(src.resolve("img/logo.png.gz")));
        assertFalse(Files.exists(src.resolve("js/old.js.gz.gz")));
        assertEquals(
                "console.log('hello hello hello');",
                new String(gunzip(src.resolve("js/app.js.gz")), StandardCharsets.UTF_8));
    }

    @Test
    void upToDateVariantsAreSkipped() throws IOException {
        write("app.js", "alert(1)");
        service.run(src);
        byte[] first = Files.readAllBytes(src.resolve("app.js.gz"));

        PrecompressResult second = service.run(src);

        assertEquals(0, second.gzip());
        assertEquals(1, second.upToDate());
        assertArrayEquals(first, Files.readAllBytes(src.resolve("app.js.gz")));
    }

    @Test
    void newerSourceIsRecompressed() throws IOException {
        Path source = write("app.js", "alert(1)");
        service.run(src);
        Files.setLastModifiedTime(src.resolve("app.js.gz"), FileTime.from(Instant.parse("2020-01-01T00:00:00Z")));
        write("app.js", "alert(2)");
        Files.setLastModifiedTime(source, FileTime.from(Instant.parse("2021-01-01T00:00:00Z")));

        PrecompressResult result = service.run(src);

        assertEquals(1, result.gzip());
        assertEquals("alert(2)", new String(gunzip(src.resolve("app.js.gz")), StandardCharsets.UTF_8));
    }

    @Test
    void leavesNoTemporaryFiles() throws IOException {
        write("data.json", "{\"a\":1}");

        service.run(src);

        assertFalse(Files.exists(src.resolve("data.json.gz.tmp")));
    }

    @Test
    void missingSourceDirectoryFails() {
        assertThrows(NoSuchFileException.class, () -> service.run(src.resolve("nope")));
    }

    @Test
    void extensionCheckIsCaseInsensitive() {
        assertTrue(PrecompressService.shouldCompress(Path.of("A.JS")));
        assertTrue(PrecompressService.shouldCompress(Path.of("icons/x.svg")));
        assertFalse(PrecompressService.shouldCompress(Path.of("x.js.br")));
        assertFalse(PrecompressService.shouldCompress(Path.of("x.js.tmp")));
        assertFalse(PrecompressService.shouldCompress(Path.of("Makefile")));
    }

    @Test
    void invalidLevelsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new GzipVariantEncoder(0));
        assertThrows(IllegalArgumentException.class, () -> new GzipVariantEncoder(10));
    }

    private Path write(String relative, String content) throws IOException {
        Path file = src.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static byte[] gunzip(Path file) throws IOException {
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            return in.readAllBytes();
        }
    }
}

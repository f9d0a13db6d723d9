package de.htwsaar.assetpipe.server;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * Startet den Server mit einem temporären Asset-Verzeichnis und prüft die Kette Ende-zu-Ende.
 */
@SpringBootTest(classes = ServerApp.class, webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class ServerIntegrationTest {

    @LocalServerPort
    int port;

    private final HttpClient client = HttpClient.newHttpClient();

    @DynamicPropertySource
    static void assetProperties(DynamicPropertyRegistry registry) throws IOException {
        Path root = Files.createTempDirectory("assetpipe-it");
        write(root.resolve("js/app.js"), "alert(1)");
        write(root.resolve("js/app.js.br"), "brotli-bytes");
        write(root.resolve("css/site.css"), "body{}");
        registry.add("assets.root", root::toString);
        registry.add("pipeline.rate-limit.limit", () -> "10000");
    }

    @Test
    void healthProbeCarriesPipelineHeaders() throws Exception {
        HttpResponse<String> response = get("/healthz", "X-Request-ID", "it-req-1");

        assertEquals(200, response.statusCode());
        assertEquals("ok", response.body());
        assertEquals("it-req-1", response.headers().firstValue("X-Request-ID").orElseThrow());
        assertEquals("DENY", response.headers().firstValue("X-Frame-Options").orElseThrow());
        assertTrue(response.headers().firstValue("Content-Security-Policy").orElseThrow().contains("'nonce-"));
        assertTrue(response.headers().firstValue("ETag").isPresent());
    }

    @Test
    void readinessProbe() throws Exception {
        HttpResponse<String> response = get("/readyz");

        assertEquals(200, response.statusCode());
        assertEquals("ready", response.body());
    }

    @Test
    void brotliSiblingIsServedToBrotliClients() throws Exception {
        HttpResponse<String> response = get("/static/js/app.js", "Accept-Encoding", "br");

        assertEquals(200, response.statusCode());
        assertEquals("br", response.headers().firstValue("Content-Encoding").orElseThrow());
        assertTrue(String.join(",", response.headers().allValues("Vary")).contains("Accept-Encoding"));
        assertTrue(response.headers().firstValue("Cache-Control").orElseThrow().contains("immutable"));
        assertTrue(response.headers().firstValue("Content-Type").orElseThrow().startsWith("text/javascript"));
        assertEquals("brotli-bytes", response.body());
    }

    @Test
    void originalIsServedWithoutAcceptEncoding() throws Exception {
        HttpResponse<String> response = get("/static/js/app.js");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Encoding").isEmpty());
        assertTrue(String.join(",", response.headers().allValues("Vary")).contains("Accept-Encoding"));
        assertEquals("alert(1)", response.body());
    }

    @Test
    void fingerprintedUrlIsImmutable() throws Exception {
        HttpResponse<String> response = get("/static/css/site.7c98040a.css");

        assertEquals(200, response.statusCode());
        assertEquals("body{}", response.body());
        assertTrue(response.headers().firstValue("Cache-Control").orElseThrow().contains("immutable"));
    }

    @Test
    void missingAssetIs404() throws Exception {
        HttpResponse<String> response = get("/static/js/missing.js");

        assertEquals(404, response.statusCode());
        assertEquals("404 page not found", response.body());
    }

    @Test
    void unknownRouteIsPlainNotFound() throws Exception {
        HttpResponse<String> response = get("/does-not-exist");

        assertEquals(404, response.statusCode());
        assertEquals("Not Found", response.body());
    }

    @Test
    void indexPageUsesNonceFromPolicyAndVersionedAssets() throws Exception {
        HttpResponse<String> response = get("/");

        assertEquals(200, response.statusCode());
        String csp = response.headers().firstValue("Content-Security-Policy").orElseThrow();
        Matcher m = Pattern.compile("'nonce-([^']+)'").matcher(csp);
        assertTrue(m.find());
        String body = response.body();
        assertTrue(body.contains("nonce=\"" + m.group(1) + "\""));
        assertTrue(body.contains("/static/js/app.6e11c72f.js"));
        assertTrue(body.contains("integrity=\"sha384-"));
    }

    @Test
    void noncesDifferPerRequest() throws Exception {
        String first = get("/healthz").headers().firstValue("Content-Security-Policy").orElseThrow();
        String second = get("/healthz").headers().firstValue("Content-Security-Policy").orElseThrow();

        assertNotEquals(first, second);
    }

    @Test
    void matchingEtagGives304() throws Exception {
        String etag = get("/static/js/app.js").headers().firstValue("ETag").orElseThrow();

        HttpResponse<String> response = get("/static/js/app.js", "If-None-Match", etag);

        assertEquals(304, response.statusCode());
        assertTrue(response.body().isEmpty());
    }

    @Test
    void gzipClientsGetCompressedPages() throws Exception {
        HttpRequest request = HttpRequest.newBuilder(uri("/api/assets/manifest"))
                .header("Accept-Encoding", "gzip")
                .GET()
                .build();

        HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());

        assertEquals(200, response.statusCode());
        assertEquals("gzip", response.headers().firstValue("Content-Encoding").orElseThrow());
        String json;
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(response.body()))) {
            json = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        assertTrue(json.contains("\"static/js/app.js\""));
        assertFalse(json.contains("app.js.br"));
    }

    private HttpResponse<String> get(String path, String... headers) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri(path)).GET();
        for (int i = 0; i + 1 < headers.length; i += 2) {
            builder.header(headers[i], headers[i + 1]);
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + port + path);
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}

package de.htwsaar.assetpipe.server;

import de.htwsaar.assetpipe.assets.delivery.PrecompressedAssetResolver;
import de.htwsaar.assetpipe.assets.delivery.VariantExistenceCache;
import de.htwsaar.assetpipe.assets.manifest.AssetManifest;
import de.htwsaar.assetpipe.assets.manifest.AssetManifestBuilder;
import de.htwsaar.assetpipe.assets.manifest.AssetManifestException;
import de.htwsaar.assetpipe.assets.manifest.AssetUrlResolver;
import de.htwsaar.assetpipe.assets.manifest.ManifestFile;
import de.htwsaar.assetpipe.server.ratelimit.RateLimiterSweeper;
import de.htwsaar.assetpipe.server.ratelimit.SlidingWindowRateLimiter;
import de.htwsaar.assetpipe.server.render.BufferPool;
import de.htwsaar.assetpipe.server.render.PooledRenderer;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Zentrale Spring-Verdrahtung der Server-Komponenten.
 *
 * <p>Das Asset-Manifest wird hier vollständig gebaut, bevor der Web-Server startet; ein Fehler
 * beim Bauen oder Laden und ein leeres Manifest brechen den Start ab.</p>
 */
@Configuration
public class ServerBeans {

    private static final Logger log = LoggerFactory.getLogger(ServerBeans.class);

    /**
     * Systemuhr für den gesamten Server-Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Baut oder lädt das Asset-Manifest.
     *
     * @param root         Asset-Verzeichnis
     * @param urlPrefix    URL-Präfix der Assets
     * @param source       {@code build} (Baum hashen) oder {@code file} (manifest.json laden)
     * @param manifestFile Pfad zur manifest.json; leer bedeutet {@code <root>/manifest.json}
     * @param maxFileSize  Größengrenze für gehashte Dateien
     * @return unveränderliches, nicht leeres Manifest
     * @throws AssetManifestException wenn das Manifest fehlt, unlesbar oder leer ist
     */
    @Bean
    public AssetManifest assetManifest(
            @Value("${assets.root:public}") String root,
            @Value("${assets.url-prefix:/static}") String urlPrefix,
            @Value("${assets.manifest.source:build}") String source,
            @Value("${assets.manifest.file:}") String manifestFile,
            @Value("${assets.max-file-size-bytes:10485760}") long maxFileSize) {

        Path rootPath = Path.of(root);
        if ("file".equals(source.trim().toLowerCase(Locale.ROOT))) {
            Path file = manifestFile.isBlank()
                    ? rootPath.resolve(AssetManifestBuilder.MANIFEST_FILE_NAME)
                    : Path.of(manifestFile);
            AssetManifest manifest = ManifestFile.read(file);
            log.atInfo()
                    .addKeyValue("file", file)
                    .addKeyValue("assets", manifest.size())
                    .log("asset manifest loaded");
            return manifest;
        }

        AssetManifest manifest = new AssetManifestBuilder(urlPrefix, maxFileSize).build(rootPath);
        if (manifest.isEmpty()) {
            throw new AssetManifestException("Asset manifest is empty, no assets under " + rootPath.toAbsolutePath());
        }
        return manifest;
    }

    @Bean
    public AssetUrlResolver assetUrlResolver(AssetManifest manifest) {
        return new AssetUrlResolver(manifest);
    }

    @Bean
    public VariantExistenceCache variantExistenceCache(
            Clock clock, @Value("${assets.variant-cache-ttl-ms:300000}") long ttlMs) {
        return new VariantExistenceCache(clock, Duration.ofMillis(Math.max(0, ttlMs)));
    }

    @Bean
    public PrecompressedAssetResolver precompressedAssetResolver(
            @Value("${assets.root:public}") String root,
            @Value("${assets.url-prefix:/static}") String urlPrefix,
            AssetManifest manifest,
            VariantExistenceCache variants) {
        return new PrecompressedAssetResolver(Path.of(root), urlPrefix, manifest, variants);
    }

    @Bean
    public SlidingWindowRateLimiter slidingWindowRateLimiter(
            @Value("${pipeline.rate-limit.limit:100}") int limit,
            @Value("${pipeline.rate-limit.window-ms:60000}") long windowMs) {
        return new SlidingWindowRateLimiter(Math.max(0, limit), windowMs);
    }

    @Bean
    public RateLimiterSweeper rateLimiterSweeper(SlidingWindowRateLimiter limiter, Clock clock) {
        return new RateLimiterSweeper(limiter, clock);
    }

    /**
     * Worker-Pool des Deadline-Guards: benannte Daemon-Threads, beim Herunterfahren beendet.
     *
     * @return Executor
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService deadlineExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "deadline-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public BufferPool bufferPool(
            @Value("${render.pool.max-buffers:64}") int maxBuffers,
            @Value("${render.pool.initial-capacity:4096}") int initialCapacity,
            @Value("${render.pool.max-retained-capacity:262144}") int maxRetainedCapacity) {
        return new BufferPool(maxBuffers, initialCapacity, maxRetainedCapacity);
    }

    @Bean
    public PooledRenderer pooledRenderer(BufferPool pool, AssetUrlResolver assets) {
        return new PooledRenderer(pool, assets);
    }
}

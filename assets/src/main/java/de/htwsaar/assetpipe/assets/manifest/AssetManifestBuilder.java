package de.htwsaar.assetpipe.assets.manifest;

import de.htwsaar.assetpipe.assets.AssetContentTypes;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Baut das {@link AssetManifest} aus einem Asset-Verzeichnis.
 *
 * <p>Der Baum wird genau einmal in sortierter Reihenfolge durchlaufen, das Ergebnis ist daher
 * für gleiche Inhalte deterministisch. Nicht aufgenommen werden:</p>
 * <ul>
 *   <li>Dateien über der Größengrenze (werden unversioniert ausgeliefert)</li>
 *   <li>vorkomprimierte Geschwister ({@code *.br}, {@code *.gz}) und {@code *.tmp}</li>
 *   <li>versteckte Dateien und die Manifest-Datei selbst</li>
 *   <li>bereits versionierte Kopien, deren Fingerprint zum eigenen Inhalt passt</li>
 * </ul>
 */
public final class AssetManifestBuilder {

    private static final Logger log = LoggerFactory.getLogger(AssetManifestBuilder.class);

    /** Standard-Größengrenze: 10 MiB. */
    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 10L * 1024 * 1024;

    public static final String MANIFEST_FILE_NAME = "manifest.json";

    private static final Pattern VERSIONED_NAME =
            Pattern.compile(".+\\.([0-9a-f]{" + ContentHasher.FINGERPRINT_LENGTH + "})(\\.[^.]+)?$");

    private final String prefixKey;
    private final long maxFileSizeBytes;

    /**
     * @param urlPrefix        URL-Präfix der Assets, z. B. {@code /static}
     * @param maxFileSizeBytes Größengrenze; {@code <= 0} bedeutet keine Grenze
     */
    public AssetManifestBuilder(String urlPrefix, long maxFileSizeBytes) {
        this.prefixKey = normalizePrefix(urlPrefix);
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    /**
     * Hasht alle Dateien unterhalb von {@code assetRoot}.
     *
     * @param assetRoot Wurzelverzeichnis der Assets
     * @return unveränderliches Manifest
     * @throws AssetManifestException wenn das Verzeichnis fehlt oder nicht lesbar ist
     */
    public AssetManifest build(Path assetRoot) {
        if (assetRoot == null || !Files.isDirectory(assetRoot)) {
            throw new AssetManifestException("Asset root is not a directory: " + assetRoot);
        }
        Path root = assetRoot.toAbsolutePath().normalize();

        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .sorted(Comparator.comparing(p -> relativeKey(root, p)))
                    .toList();
        } catch (IOException | UncheckedIOException e) {
            throw new AssetManifestException("Failed to walk asset root " + root, e);
        }

        List<AssetRecord> records = new ArrayList<>();
        int skipped = 0;
        for (Path file : files) {
            String relative = relativeKey(root, file);
            if (isExcluded(relative)) continue;

            try {
                long size = Files.size(file);
                if (maxFileSizeBytes > 0 && size > maxFileSizeBytes) {
                    log.atDebug()
                            .addKeyValue("path", relative)
                            .addKeyValue("size", size)
                            .log("asset above size limit, served unversioned");
                    skipped++;
                    continue;
                }
                byte[] content = Files.readAllBytes(file);
                HashedContent hashed = ContentHasher.hash(content);
                if (isVersionedCopy(file.getFileName().toString(), hashed)) continue;

                records.add(toRecord(relative, hashed, content.length));
            } catch (IOException e) {
                throw new AssetManifestException("Failed to read asset " + file, e);
            }
        }

        AssetManifest manifest = AssetManifest.of(records);
        log.atInfo()
                .addKeyValue("root", root)
                .addKeyValue("assets", manifest.size())
                .addKeyValue("skipped", skipped)
                .log("asset manifest built");
        return manifest;
    }

    AssetRecord toRecord(String relative, HashedContent hashed, long size) {
        String logical = prefixKey.isEmpty() ? relative : prefixKey + "/" + relative;
        int slash = logical.lastIndexOf('/');
        String dir = slash >= 0 ? logical.substring(0, slash + 1) : "";
        String name = slash >= 0 ? logical.substring(slash + 1) : logical;
        String versioned = "/" + dir + ContentHasher.versionedName(name, hashed.fingerprint());
        return new AssetRecord(logical, versioned, hashed.integrity(), size, AssetContentTypes.forName(name));
    }

    public String prefixKey() {
        return prefixKey;
    }

    private static boolean isExcluded(String relative) {
        String name = relative.substring(relative.lastIndexOf('/') + 1);
        if (name.startsWith(".")) return true;
        if (name.endsWith(".br") || name.endsWith(".gz") || name.endsWith(".tmp")) return true;
        return relative.equals(MANIFEST_FILE_NAME);
    }

    private static boolean isVersionedCopy(String fileName, HashedContent hashed) {
        Matcher m = VERSIONED_NAME.matcher(fileName);
        return m.matches() && m.group(1).equals(hashed.fingerprint());
    }

    static String relativeKey(Path root, Path file) {
        return root.relativize(file).toString().replace(file.getFileSystem().getSeparator(), "/");
    }

    /**
     * {@code "/static/"} → {@code "static"}, {@code "/"} → {@code ""}
     */
    public static String normalizePrefix(String urlPrefix) {
        if (urlPrefix == null) return "";
        String p = urlPrefix.trim();
        while (p.startsWith("/")) p = p.substring(1);
        while (p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }
}

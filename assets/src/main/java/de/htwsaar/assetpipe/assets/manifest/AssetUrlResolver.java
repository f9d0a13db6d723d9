package de.htwsaar.assetpipe.assets.manifest;

import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Helfer für Templates: logischer Pfad → versionierte URL bzw. SRI-Wert.
 *
 * <p>Unbekannte Assets lassen das Rendern nicht scheitern: die URL fällt auf den unversionierten
 * Pfad zurück, der SRI-Wert ist leer, und es wird eine Warnung geloggt.</p>
 */
public class AssetUrlResolver {

    private static final Logger log = LoggerFactory.getLogger(AssetUrlResolver.class);

    private final AssetManifest manifest;

    public AssetUrlResolver(AssetManifest manifest) {
        this.manifest = Objects.requireNonNull(manifest, "manifest must not be null");
    }

    public String assetUrl(String logicalPath) {
        Optional<AssetRecord> record = manifest.lookup(logicalPath);
        if (record.isPresent()) {
            return record.get().versionedPath();
        }
        log.atWarn().addKeyValue("path", logicalPath).log("asset not found in manifest, using unversioned path");
        if (logicalPath == null) return "";
        return AssetManifest.withLeadingSlash(logicalPath);
    }

    public String assetSri(String logicalPath) {
        return manifest.lookup(logicalPath).map(AssetRecord::integrityHash).orElse("");
    }

    public boolean hasAsset(String logicalPath) {
        return manifest.lookup(logicalPath).isPresent();
    }

    public Optional<AssetRecord> info(String logicalPath) {
        return manifest.lookup(logicalPath);
    }

    public AssetManifest manifest() {
        return manifest;
    }
}

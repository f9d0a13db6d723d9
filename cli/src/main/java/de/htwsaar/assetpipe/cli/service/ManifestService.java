package de.htwsaar.assetpipe.cli.service;

import de.htwsaar.assetpipe.assets.manifest.AssetManifest;
import de.htwsaar.assetpipe.assets.manifest.AssetManifestBuilder;
import de.htwsaar.assetpipe.assets.manifest.AssetRecord;
import de.htwsaar.assetpipe.assets.manifest.ManifestFile;
import de.htwsaar.assetpipe.cli.util.PathUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Erzeugt {@code manifest.json} für ein Asset-Verzeichnis und legt auf Wunsch die
 * fingerprinted Kopien daneben ab.
 */
public final class ManifestService {

    private final AssetManifestBuilder builder;

    public ManifestService(String urlPrefix, long maxFileSizeBytes) {
        this.builder = new AssetManifestBuilder(urlPrefix, maxFileSizeBytes);
    }

    /**
     * @param src            Asset-Verzeichnis
     * @param out            Ziel der Manifest-Datei
     * @param writeVersioned ob {@code name.<fingerprint>.ext}-Kopien angelegt werden
     * @return Zusammenfassung; bei leerem Verzeichnis wird nichts geschrieben
     * @throws de.htwsaar.assetpipe.assets.manifest.AssetManifestException wenn Bauen oder Schreiben scheitert
     * @throws IOException wenn eine Kopie nicht angelegt werden kann
     */
    public ManifestSummary generate(Path src, Path out, boolean writeVersioned) throws IOException {
        AssetManifest manifest = builder.build(src);
        if (manifest.isEmpty()) {
            return new ManifestSummary(0, 0, null);
        }

        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ManifestFile.write(manifest, out);

        int copies = 0;
        if (writeVersioned) {
            for (AssetRecord record : manifest.records()) {
                Path original = src.resolve(toFileKey(record.logicalPath()));
                Path versioned = src.resolve(toFileKey(record.versionedPath()));
                if (Files.exists(versioned)) continue;

                Path tmp = PathUtils.tmpSibling(versioned);
                try {
                    Files.copy(original, tmp, StandardCopyOption.REPLACE_EXISTING);
                    PathUtils.moveIntoPlace(tmp, versioned);
                } finally {
                    Files.deleteIfExists(tmp);
                }
                copies++;
            }
        }
        return new ManifestSummary(manifest.size(), copies, out);
    }

    /** {@code /static/js/app.js} → {@code js/app.js} */
    String toFileKey(String urlPath) {
        String key = PathUtils.stripLeadingSlash(urlPath);
        String prefixKey = builder.prefixKey();
        if (!prefixKey.isEmpty() && key.startsWith(prefixKey + "/")) {
            key = key.substring(prefixKey.length() + 1);
        }
        return key;
    }
}

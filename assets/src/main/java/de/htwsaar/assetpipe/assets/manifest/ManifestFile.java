package de.htwsaar.assetpipe.assets.manifest;

import de.htwsaar.assetpipe.assets.AssetContentTypes;
import de.htwsaar.assetpipe.common.serialization.AssetPipeSerializationException;
import de.htwsaar.assetpipe.common.serialization.JacksonCodec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Lesen und Schreiben von {@code manifest.json}.
 */
public final class ManifestFile {

    private ManifestFile() {}

    /**
     * Lädt ein vorab gebautes Manifest.
     *
     * @param file Pfad zu {@code manifest.json}
     * @return Manifest
     * @throws AssetManifestException wenn die Datei fehlt, kein gültiges JSON enthält oder
     *                                keine Einträge hat
     */
    public static AssetManifest read(Path file) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new AssetManifestException("Manifest file not found: " + file);
        }

        ManifestDocument doc;
        try {
            doc = JacksonCodec.fromJson(Files.readString(file, StandardCharsets.UTF_8), ManifestDocument.class);
        } catch (IOException e) {
            throw new AssetManifestException("Failed to read manifest " + file, e);
        } catch (AssetPipeSerializationException e) {
            throw new AssetManifestException("Failed to parse manifest " + file, e);
        }

        if (doc == null || doc.files() == null || doc.files().isEmpty()) {
            throw new AssetManifestException("Manifest " + file + " contains no files");
        }

        List<AssetRecord> records = new ArrayList<>(doc.files().size());
        for (Map.Entry<String, ManifestDocument.Entry> e : doc.files().entrySet()) {
            records.add(toRecord(e.getKey(), e.getValue()));
        }
        return AssetManifest.of(records);
    }

    /**
     * Schreibt das Manifest über eine temporäre Datei und ein Rename.
     *
     * @param manifest Manifest
     * @param file     Zieldatei
     */
    public static void write(AssetManifest manifest, Path file) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(tmp, JacksonCodec.toPrettyJson(toDocument(manifest)), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new AssetManifestException("Failed to write manifest " + file, e);
        }
    }

    public static ManifestDocument toDocument(AssetManifest manifest) {
        Map<String, ManifestDocument.Entry> files = new TreeMap<>();
        for (AssetRecord r : manifest.records()) {
            String versioned = r.versionedPath();
            String filename = versioned.substring(versioned.lastIndexOf('/') + 1);
            files.put(r.logicalPath(), new ManifestDocument.Entry(
                    versioned, filename, r.integrityHash(), r.sizeBytes(), r.contentType()));
        }
        return new ManifestDocument(files);
    }

    private static AssetRecord toRecord(String logicalPath, ManifestDocument.Entry entry) {
        if (entry == null) {
            throw new AssetManifestException("Manifest entry for " + logicalPath + " is empty");
        }
        String versioned = entry.path();
        if (versioned == null || versioned.isBlank()) {
            if (entry.filename() == null || entry.filename().isBlank()) {
                throw new AssetManifestException("Manifest entry for " + logicalPath + " has no path");
            }
            // filename ist nur der Dateiname, das Verzeichnis kommt vom logischen Pfad
            String logical = AssetManifest.stripLeadingSlash(logicalPath);
            versioned = "/" + logical.substring(0, logical.lastIndexOf('/') + 1) + entry.filename();
        }
        String contentType = entry.contentType() != null
                ? entry.contentType()
                : AssetContentTypes.forName(logicalPath);
        return new AssetRecord(
                AssetManifest.stripLeadingSlash(logicalPath), versioned, entry.sri(), entry.size(), contentType);
    }
}

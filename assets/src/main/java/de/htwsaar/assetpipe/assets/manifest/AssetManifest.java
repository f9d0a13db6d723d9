package de.htwsaar.assetpipe.assets.manifest;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Unveränderliches Asset-Manifest: logischer Pfad → {@link AssetRecord}.
 *
 * <p>Nach der Konstruktion wird nichts mehr verändert; Lookups sind daher ohne Locking für
 * beliebig viele parallele Leser sicher.</p>
 */
public final class AssetManifest {

    private final Map<String, AssetRecord> byLogicalPath;
    private final Map<String, AssetRecord> byVersionedPath;

    private AssetManifest(Map<String, AssetRecord> byLogicalPath, Map<String, AssetRecord> byVersionedPath) {
        this.byLogicalPath = Map.copyOf(byLogicalPath);
        this.byVersionedPath = Map.copyOf(byVersionedPath);
    }

    /**
     * Erstellt ein Manifest aus einzelnen Einträgen.
     *
     * @param records Einträge mit eindeutigen logischen Pfaden
     * @return neues Manifest
     * @throws AssetManifestException bei doppelten logischen oder versionierten Pfaden
     */
    public static AssetManifest of(Collection<AssetRecord> records) {
        Map<String, AssetRecord> logical = new HashMap<>();
        Map<String, AssetRecord> versioned = new HashMap<>();
        for (AssetRecord record : records) {
            String key = stripLeadingSlash(record.logicalPath());
            if (logical.putIfAbsent(key, record) != null) {
                throw new AssetManifestException("Duplicate logical path in manifest: " + key);
            }
            if (versioned.putIfAbsent(withLeadingSlash(record.versionedPath()), record) != null) {
                throw new AssetManifestException("Duplicate versioned path in manifest: " + record.versionedPath());
            }
        }
        return new AssetManifest(logical, versioned);
    }

    public static AssetManifest empty() {
        return new AssetManifest(Map.of(), Map.of());
    }

    /**
     * Sucht einen Eintrag über den logischen Pfad; probiert die Form mit und ohne führenden Slash.
     * Groß-/Kleinschreibung muss exakt passen.
     *
     * @param logicalPath z. B. {@code /static/js/app.js} oder {@code static/js/app.js}
     * @return Eintrag, falls vorhanden
     */
    public Optional<AssetRecord> lookup(String logicalPath) {
        if (logicalPath == null || logicalPath.isBlank()) return Optional.empty();
        AssetRecord direct = byLogicalPath.get(logicalPath);
        if (direct != null) return Optional.of(direct);
        return Optional.ofNullable(byLogicalPath.get(stripLeadingSlash(logicalPath)));
    }

    /**
     * Löst eine versionierte URL auf ihren Eintrag zurück auf.
     *
     * @param requestPath z. B. {@code /static/js/app.3f2a1b9c.js}
     * @return Eintrag, falls die URL ein bekannter Fingerprint-Pfad ist
     */
    public Optional<AssetRecord> resolveVersioned(String requestPath) {
        if (requestPath == null || requestPath.isBlank()) return Optional.empty();
        return Optional.ofNullable(byVersionedPath.get(withLeadingSlash(requestPath)));
    }

    /**
     * @return alle Einträge, sortiert nach logischem Pfad
     */
    public List<AssetRecord> records() {
        return byLogicalPath.values().stream()
                .sorted(Comparator.comparing(AssetRecord::logicalPath))
                .toList();
    }

    public int size() {
        return byLogicalPath.size();
    }

    public boolean isEmpty() {
        return byLogicalPath.isEmpty();
    }

    static String stripLeadingSlash(String path) {
        String p = path;
        while (p.startsWith("/")) p = p.substring(1);
        return p;
    }

    static String withLeadingSlash(String path) {
        return path.startsWith("/") ? path : "/" + path;
    }
}

package de.htwsaar.assetpipe.assets.manifest;

import java.util.Objects;

/**
 * Unveränderlicher Manifest-Eintrag eines statischen Assets.
 *
 * @param logicalPath   logischer Pfad ohne führenden Slash, z. B. {@code static/js/app.js}
 * @param versionedPath URL-Pfad mit Fingerprint, z. B. {@code /static/js/app.3f2a1b9c.js}
 * @param integrityHash SRI-Wert im Format {@code sha384-<base64>}
 * @param sizeBytes     Dateigröße in Bytes
 * @param contentType   MIME-Type der Originaldatei
 */
public record AssetRecord(
        String logicalPath, String versionedPath, String integrityHash, long sizeBytes, String contentType) {

    public AssetRecord {
        Objects.requireNonNull(logicalPath, "logicalPath must not be null");
        Objects.requireNonNull(versionedPath, "versionedPath must not be null");
        integrityHash = integrityHash != null ? integrityHash : "";
        contentType = contentType != null ? contentType : "application/octet-stream";
    }
}

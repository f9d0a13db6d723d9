package de.htwsaar.assetpipe.assets.manifest;

import de.htwsaar.assetpipe.common.util.DigestUtil;
import java.util.Objects;

/**
 * Reine Funktion: Datei-Inhalt → Digest, Fingerprint und SRI-Wert.
 *
 * <p>Gleiche Bytes ergeben immer denselben Fingerprint; damit ändert sich die URL eines Assets
 * genau dann, wenn sich sein Inhalt ändert.</p>
 */
public final class ContentHasher {

    /** Anzahl Hex-Zeichen des SHA-256-Digests im versionierten Dateinamen. */
    public static final int FINGERPRINT_LENGTH = 8;

    private ContentHasher() {}

    public static HashedContent hash(byte[] content) {
        Objects.requireNonNull(content, "content must not be null");
        String hex = DigestUtil.sha256Hex(content);
        return new HashedContent(hex, hex.substring(0, FINGERPRINT_LENGTH), DigestUtil.sri384(content));
    }

    /**
     * Fügt den Fingerprint vor der letzten Dateiendung ein.
     * {@code app.js} → {@code app.3f2a1b9c.js}, {@code LICENSE} → {@code LICENSE.3f2a1b9c}
     *
     * @param fileName    Dateiname ohne Verzeichnis
     * @param fingerprint Fingerprint
     * @return versionierter Dateiname
     */
    public static String versionedName(String fileName, String fingerprint) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + "." + fingerprint;
        }
        return fileName.substring(0, dot) + "." + fingerprint + fileName.substring(dot);
    }
}

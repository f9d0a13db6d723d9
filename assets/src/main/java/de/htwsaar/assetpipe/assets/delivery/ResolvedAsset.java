package de.htwsaar.assetpipe.assets.delivery;

import java.nio.file.Path;

/**
 * Ergebnis der Varianten-Auswahl.
 *
 * @param file          auszuliefernde Datei (Original oder Geschwister)
 * @param encoding      gewählte Codierung, {@code null} für das Original
 * @param contentType   Content-Type der Originaldatei
 * @param fingerprinted {@code true}, wenn über die versionierte URL angefragt wurde
 */
public record ResolvedAsset(Path file, ContentEncoding encoding, String contentType, boolean fingerprinted) {

    public boolean isCompressed() {
        return encoding != null;
    }

    /** Inhalt unter dieser URL ändert sich nie. */
    public boolean isImmutable() {
        return isCompressed() || fingerprinted;
    }
}

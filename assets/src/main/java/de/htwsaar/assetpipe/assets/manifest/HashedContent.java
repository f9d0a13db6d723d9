package de.htwsaar.assetpipe.assets.manifest;

/**
 * Ergebnis des Content-Hashings einer Datei.
 *
 * @param sha256Hex   vollständiger SHA-256-Digest (hex)
 * @param fingerprint kurzer Fingerprint für versionierte Dateinamen
 * @param integrity   SRI-Wert
 */
public record HashedContent(String sha256Hex, String fingerprint, String integrity) {}

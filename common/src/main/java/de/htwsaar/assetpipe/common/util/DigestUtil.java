package de.htwsaar.assetpipe.common.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;

/**
 * Hash-Hilfsfunktionen für Fingerprints, SRI-Werte und ETags.
 */
public final class DigestUtil {

    private DigestUtil() {}

    public static byte[] sha256(byte[] data) {
        return digest("SHA-256", data);
    }

    public static String sha256Hex(byte[] data) {
        return toHex(sha256(data));
    }

    /**
     * Subresource-Integrity-Wert im Browser-Format {@code sha384-<base64>}.
     *
     * @param data Datei-Inhalt
     * @return SRI-String
     */
    public static String sri384(byte[] data) {
        return "sha384-" + Base64.getEncoder().encodeToString(digest("SHA-384", data));
    }

    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }

    private static byte[] digest(String algorithm, byte[] data) {
        try {
            return MessageDigest.getInstance(algorithm).digest(data);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute " + algorithm, e);
        }
    }
}

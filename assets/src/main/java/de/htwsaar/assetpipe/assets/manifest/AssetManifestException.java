package de.htwsaar.assetpipe.assets.manifest;

/**
 * Fehler beim Aufbau oder Laden des Asset-Manifests.
 * Beim Start des Servers ist diese Exception fatal: ohne Manifest werden keine Requests angenommen.
 */
public class AssetManifestException extends RuntimeException {

    public AssetManifestException(String message) {
        super(message);
    }

    public AssetManifestException(String message, Throwable cause) {
        super(message, cause);
    }
}

package de.htwsaar.assetpipe.server.render;

import de.htwsaar.assetpipe.assets.manifest.AssetUrlResolver;

/**
 * Werte, die einem View beim Rendern zur Verfügung stehen.
 *
 * @param cspNonce  Nonce des aktuellen Requests für {@code <script nonce>}
 * @param requestId Request-ID
 * @param assets    Auflösung logischer Asset-Pfade
 */
public record ViewContext(String cspNonce, String requestId, AssetUrlResolver assets) {

    public String assetUrl(String logicalPath) {
        return assets.assetUrl(logicalPath);
    }

    public String assetSri(String logicalPath) {
        return assets.assetSri(logicalPath);
    }
}

package de.htwsaar.assetpipe.assets.delivery;

import de.htwsaar.assetpipe.assets.AssetContentTypes;
import de.htwsaar.assetpipe.assets.manifest.AssetManifest;
import de.htwsaar.assetpipe.assets.manifest.AssetManifestBuilder;
import de.htwsaar.assetpipe.assets.manifest.AssetRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Wählt für einen Asset-Request die beste vorhandene Variante: {@code .br}, dann {@code .gz},
 * dann das Original.
 *
 * <p>Versionierte URLs ({@code app.3f2a1b9c.js}) werden über das Manifest auf die Originaldatei
 * zurückgeführt. Pfade außerhalb des Asset-Verzeichnisses werden nie aufgelöst.</p>
 */
public class PrecompressedAssetResolver {

    private final Path root;
    private final String prefixKey;
    private final AssetManifest manifest;
    private final VariantExistenceCache variants;

    public PrecompressedAssetResolver(
            Path root, String urlPrefix, AssetManifest manifest, VariantExistenceCache variants) {
        this.root = Objects.requireNonNull(root, "root must not be null").toAbsolutePath().normalize();
        this.prefixKey = AssetManifestBuilder.normalizePrefix(urlPrefix);
        this.manifest = Objects.requireNonNull(manifest, "manifest must not be null");
        this.variants = Objects.requireNonNull(variants, "variants must not be null");
    }

    /**
     * @param requestPath    Request-Pfad inklusive Präfix, z. B. {@code /static/js/app.js}
     * @param acceptEncoding Wert von {@code Accept-Encoding}, darf {@code null} sein
     * @return gewählte Variante oder leer, wenn das Original nicht existiert
     */
    public Optional<ResolvedAsset> resolve(String requestPath, String acceptEncoding) {
        Optional<ResolvedAsset> original = resolveOriginal(requestPath);
        if (original.isEmpty() || acceptEncoding == null || acceptEncoding.isBlank()) {
            return original;
        }

        ResolvedAsset asset = original.get();
        AcceptEncoding accepted = AcceptEncoding.parse(acceptEncoding);
        for (ContentEncoding encoding : ContentEncoding.values()) {
            if (!accepted.accepts(encoding)) continue;
            Path sibling = asset.file().resolveSibling(asset.file().getFileName() + encoding.extension());
            if (variants.exists(sibling)) {
                return Optional.of(new ResolvedAsset(sibling, encoding, asset.contentType(), asset.fingerprinted()));
            }
        }
        return original;
    }

    /**
     * Löst nur die Originaldatei auf, ohne Content-Negotiation.
     */
    public Optional<ResolvedAsset> resolveOriginal(String requestPath) {
        Optional<String> relative = relativePath(requestPath);
        if (relative.isEmpty()) return Optional.empty();

        String rel = relative.get();
        boolean fingerprinted = false;
        Optional<AssetRecord> versioned = manifest.resolveVersioned(requestPath);
        if (versioned.isPresent()) {
            String logical = versioned.get().logicalPath();
            rel = !prefixKey.isEmpty() && logical.startsWith(prefixKey + "/")
                    ? logical.substring(prefixKey.length() + 1)
                    : logical;
            fingerprinted = true;
        }

        Path file = root.resolve(rel).normalize();
        if (!file.startsWith(root) || !Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedAsset(file, null, AssetContentTypes.forName(rel), fingerprinted));
    }

    /**
     * Entfernt das URL-Präfix und lehnt Traversal ab.
     * {@code /static/js/app.js} → {@code js/app.js}
     */
    Optional<String> relativePath(String requestPath) {
        if (requestPath == null || requestPath.isBlank()) return Optional.empty();
        if (requestPath.indexOf('\\') >= 0 || requestPath.indexOf('\0') >= 0) return Optional.empty();

        String path = requestPath;
        while (path.startsWith("/")) path = path.substring(1);
        if (!prefixKey.isEmpty()) {
            if (!path.startsWith(prefixKey + "/")) return Optional.empty();
            path = path.substring(prefixKey.length() + 1);
        }
        if (path.isEmpty()) return Optional.empty();
        for (String segment : path.split("/")) {
            if (segment.equals("..") || segment.equals(".")) return Optional.empty();
        }
        return Optional.of(path);
    }
}

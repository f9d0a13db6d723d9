package de.htwsaar.assetpipe.cli.command;

import de.htwsaar.assetpipe.assets.manifest.AssetManifestBuilder;
import de.htwsaar.assetpipe.assets.manifest.AssetManifestException;
import de.htwsaar.assetpipe.cli.di.CliContext;
import de.htwsaar.assetpipe.cli.service.ManifestService;
import de.htwsaar.assetpipe.cli.service.ManifestSummary;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Schreibt das Asset-Manifest.
 *
 * <p>Exit-Codes: 0 = OK, 2 = keine Assets gefunden, 1 = Fehler beim Bauen oder Schreiben.</p>
 */
@Command(
        name = "manifest",
        description = "Hash assets and write manifest.json",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  manifest --src web/static",
            "  manifest --src web/static --out build/manifest.json --prefix /assets --write-versioned"
        })
public final class ManifestCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Option(
            names = {"--src"},
            defaultValue = "web/static",
            paramLabel = "DIR",
            description = "Source directory with static assets (default: ${DEFAULT-VALUE})")
    private Path src;

    @Option(
            names = {"--out"},
            paramLabel = "FILE",
            description = "Manifest file (default: <src>/manifest.json)")
    private Path out;

    @Option(
            names = {"--prefix"},
            defaultValue = "/static",
            paramLabel = "PREFIX",
            description = "URL prefix of the assets (default: ${DEFAULT-VALUE})")
    private String prefix;

    @Option(
            names = {"--max-size"},
            defaultValue = "" + AssetManifestBuilder.DEFAULT_MAX_FILE_SIZE_BYTES,
            paramLabel = "BYTES",
            description = "Larger files stay unversioned, 0 disables the limit (default: ${DEFAULT-VALUE})")
    private long maxSize;

    @Option(names = {"--write-versioned"}, description = "Also write name.<fingerprint>.ext copies")
    private boolean writeVersioned;

    public ManifestCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        Path target = out != null ? out : src.resolve(AssetManifestBuilder.MANIFEST_FILE_NAME);
        try {
            ManifestSummary summary = new ManifestService(prefix, maxSize).generate(src, target, writeVersioned);
            if (summary.assets() == 0) {
                ctx.err().printf("[MANIFEST] No assets found in %s%n", src);
                ctx.err().flush();
                return 2;
            }
            ctx.out()
                    .printf(
                            "[MANIFEST] assets=%d, versioned-copies=%d -> %s%n",
                            summary.assets(),
                            summary.versionedCopies(),
                            summary.manifestFile());
            ctx.out().flush();
            return 0;
        } catch (AssetManifestException | IOException e) {
            ctx.err().printf("[MANIFEST] Failed: %s%n", e.getMessage());
            ctx.err().flush();
            return 1;
        }
    }
}

package de.htwsaar.assetpipe.cli.command;

import de.htwsaar.assetpipe.cli.di.CliContext;
import de.htwsaar.assetpipe.cli.service.BrotliVariantEncoder;
import de.htwsaar.assetpipe.cli.service.GzipVariantEncoder;
import de.htwsaar.assetpipe.cli.service.PrecompressResult;
import de.htwsaar.assetpipe.cli.service.PrecompressService;
import de.htwsaar.assetpipe.cli.service.VariantEncoder;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Erzeugt {@code .br}/{@code .gz}-Geschwister für textartige Assets.
 *
 * <p>Exit-Codes:
 * <ul>
 *   <li>0 = OK</li>
 *   <li>2 = nichts zu tun oder ungültige Stufe</li>
 *   <li>1 = IO-Fehler</li>
 * </ul>
 */
@Command(
        name = "precompress",
        description = "Write .br/.gz siblings next to text-like assets",
        mixinStandardHelpOptions = true,
        footerHeading = "%nBeispiele:%n",
        footer = {
            "  precompress --src web/static --brotli --gzip",
            "  precompress --src web/static --gzip --gzq 6"
        })
public final class PrecompressCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Option(
            names = {"--src"},
            defaultValue = "web/static",
            paramLabel = "DIR",
            description = "Source directory with static assets (default: ${DEFAULT-VALUE})")
    private Path src;

    @Option(names = {"--brotli"}, description = "Generate .br alongside originals")
    private boolean brotli;

    @Option(names = {"--gzip"}, description = "Generate .gz alongside originals")
    private boolean gzip;

    @Option(
            names = {"--brq"},
            defaultValue = "11",
            paramLabel = "0-11",
            description = "Brotli quality (default: ${DEFAULT-VALUE})")
    private int brotliQuality;

    @Option(
            names = {"--gzq"},
            defaultValue = "9",
            paramLabel = "1-9",
            description = "Gzip level (default: ${DEFAULT-VALUE})")
    private int gzipLevel;

    public PrecompressCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        if (!brotli && !gzip) {
            ctx.err().println("[PRECOMPRESS] Nothing to do: enable --brotli and/or --gzip");
            ctx.err().flush();
            return 2;
        }

        List<VariantEncoder> encoders = new ArrayList<>();
        try {
            if (brotli) encoders.add(new BrotliVariantEncoder(brotliQuality));
            if (gzip) encoders.add(new GzipVariantEncoder(gzipLevel));
        } catch (IllegalArgumentException e) {
            ctx.err().printf("[PRECOMPRESS] %s%n", e.getMessage());
            ctx.err().flush();
            return 2;
        } catch (UnsatisfiedLinkError e) {
            ctx.err().printf("[PRECOMPRESS] Brotli native library unavailable: %s%n", e.getMessage());
            ctx.err().flush();
            return 1;
        }

        try {
            PrecompressResult result = new PrecompressService(encoders).run(src);
            ctx.out()
                    .printf(
                            "[PRECOMPRESS] scanned=%d, br=%d, gz=%d, up-to-date=%d%n",
                            result.scanned(),
                            result.brotli(),
                            result.gzip(),
                            result.upToDate());
            ctx.out().flush();
            return 0;
        } catch (IOException e) {
            ctx.err().printf("[PRECOMPRESS] Failed: %s%n", e);
            ctx.err().flush();
            return 1;
        }
    }
}

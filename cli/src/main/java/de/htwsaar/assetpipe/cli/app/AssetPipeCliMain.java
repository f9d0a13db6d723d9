package de.htwsaar.assetpipe.cli.app;

import de.htwsaar.assetpipe.cli.command.ManifestCommand;
import de.htwsaar.assetpipe.cli.command.PrecompressCommand;
import de.htwsaar.assetpipe.cli.command.root.AssetPipeRootCommand;
import de.htwsaar.assetpipe.cli.di.CliContext;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import picocli.CommandLine;

/**
 * Einstiegspunkt des Asset-Build-Tools.
 *
 * <p>Baut den Kommandobaum aus fertigen Command-Instanzen, die sich den {@link CliContext}
 * teilen, führt den Befehl aus und beendet den Prozess mit dessen Exit-Code.</p>
 */
public final class AssetPipeCliMain {

    private AssetPipeCliMain() {}

    public static void main(String[] args) {
        CliContext ctx = new CliContext(
                new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8), true),
                new PrintWriter(new OutputStreamWriter(System.err, StandardCharsets.UTF_8), true));

        System.exit(commandLine(ctx).execute(args));
    }

    /**
     * Erzeugt die Kommandozeile mit umgeleiteten Ausgabekanälen (auch für Tests).
     *
     * @param ctx CLI-Kontext
     * @return konfigurierte Picocli-Kommandozeile
     */
    public static CommandLine commandLine(CliContext ctx) {
        CommandLine cmd = new CommandLine(new AssetPipeRootCommand(ctx))
                .addSubcommand(new PrecompressCommand(ctx))
                .addSubcommand(new ManifestCommand(ctx));
        cmd.setOut(ctx.out());
        cmd.setErr(ctx.err());
        return cmd;
    }
}

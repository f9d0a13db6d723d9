package de.htwsaar.assetpipe.cli.command.root;

import de.htwsaar.assetpipe.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>{@code precompress} und {@code manifest} hängt {@code AssetPipeCliMain} als Instanzen an.
 * Ohne Subcommand wird die Usage angezeigt.</p>
 */
@Command(
        name = "assetpipe",
        description = "Build tool for static assets",
        mixinStandardHelpOptions = true,
        subcommands = {HelpCommand.class})
public final class AssetPipeRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public AssetPipeRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().println("Tipp: Verwende `assetpipe help <command>` für Details.");
        ctx.out().flush();
    }
}

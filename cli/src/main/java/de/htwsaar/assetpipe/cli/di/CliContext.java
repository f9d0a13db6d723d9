package de.htwsaar.assetpipe.cli.di;

import java.io.PrintWriter;
import java.util.Objects;

/**
 * Gemeinsamer Laufzeit-Kontext für CLI-Commands.
 *
 * <p>Bündelt die Ausgabekanäle (stdout/stderr), damit Commands per Constructor Injection testbar
 * bleiben. Fachliche Services gehören nicht hierher.</p>
 */
public final class CliContext {
    private final PrintWriter out;
    private final PrintWriter err;

    /**
     * @param out Writer für normale Ausgaben
     * @param err Writer für Fehlermeldungen
     */
    public CliContext(PrintWriter out, PrintWriter err) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
    }

    public PrintWriter out() {
        return out;
    }

    public PrintWriter err() {
        return err;
    }
}

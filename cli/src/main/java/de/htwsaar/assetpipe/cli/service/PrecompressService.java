package de.htwsaar.assetpipe.cli.service;

import de.htwsaar.assetpipe.assets.delivery.ContentEncoding;
import de.htwsaar.assetpipe.cli.util.PathUtils;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Schreibt vorkomprimierte Geschwister neben textartige Assets.
 *
 * <p>Eine Variante wird nur neu erzeugt, wenn sie fehlt oder älter als die Quelle ist (mit einer
 * Sekunde Toleranz für grobe Dateisystem-Zeitstempel). Geschrieben wird immer erst in eine
 * {@code .tmp}-Datei, die danach umbenannt wird.</p>
 */
public final class PrecompressService {

    public static final Set<String> COMPRESSIBLE_EXTENSIONS =
            Set.of(".js", ".mjs", ".css", ".svg", ".json", ".wasm", ".txt", ".xml");

    static final long MTIME_TOLERANCE_MS = 1000;

    private final List<VariantEncoder> encoders;

    public PrecompressService(List<VariantEncoder> encoders) {
        this.encoders = List.copyOf(Objects.requireNonNull(encoders, "encoders"));
    }

    /**
     * @param src Asset-Verzeichnis
     * @return Zähler des Laufs
     * @throws IOException wenn das Verzeichnis nicht lesbar ist oder eine Variante nicht geschrieben werden kann
     */
    public PrecompressResult run(Path src) throws IOException {
        if (!Files.isDirectory(src)) {
            throw new NoSuchFileException(src.toString(), null, "not a directory");
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(src)) {
            files = walk.filter(Files::isRegularFile).sorted().toList();
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }

        int scanned = 0;
        int brotli = 0;
        int gzip = 0;
        int upToDate = 0;
        for (Path file : files) {
            if (!shouldCompress(file)) continue;
            scanned++;

            for (VariantEncoder encoder : encoders) {
                Path target = variantOf(file, encoder.encoding());
                if (isUpToDate(file, target)) {
                    upToDate++;
                    continue;
                }
                write(file, target, encoder);
                if (encoder.encoding() == ContentEncoding.BROTLI) {
                    brotli++;
                } else {
                    gzip++;
                }
            }
        }
        return new PrecompressResult(scanned, brotli, gzip, upToDate);
    }

    static boolean shouldCompress(Path file) {
        String name = PathUtils.lowerName(file);
        if (name.endsWith(".br") || name.endsWith(".gz") || name.endsWith(PathUtils.TMP_SUFFIX)) {
            return false;
        }
        int dot = name.lastIndexOf('.');
        return dot >= 0 && COMPRESSIBLE_EXTENSIONS.contains(name.substring(dot));
    }

    static Path variantOf(Path file, ContentEncoding encoding) {
        return file.resolveSibling(file.getFileName() + encoding.extension());
    }

    static boolean isUpToDate(Path source, Path variant) throws IOException {
        if (!Files.isRegularFile(variant)) return false;
        FileTime sourceTime = Files.getLastModifiedTime(source);
        FileTime variantTime = Files.getLastModifiedTime(variant);
        return variantTime.toMillis() >= sourceTime.toMillis() - MTIME_TOLERANCE_MS;
    }

    private static void write(Path source, Path target, VariantEncoder encoder) throws IOException {
        Path tmp = PathUtils.tmpSibling(target);
        try {
            try (InputStream in = Files.newInputStream(source);
                    OutputStream out = encoder.wrap(Files.newOutputStream(tmp))) {
                in.transferTo(out);
            }
            PathUtils.moveIntoPlace(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}

package de.htwsaar.assetpipe.cli.service;

import com.aayushatharva.brotli4j.Brotli4jLoader;
import com.aayushatharva.brotli4j.encoder.BrotliOutputStream;
import com.aayushatharva.brotli4j.encoder.Encoder;
import de.htwsaar.assetpipe.assets.delivery.ContentEncoding;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Brotli über die native Bibliothek von brotli4j.
 *
 * <p>Die Bibliothek wird beim Erzeugen geladen; fehlt sie für die Plattform, schlägt der
 * Konstruktor mit {@link UnsatisfiedLinkError} fehl.</p>
 */
public final class BrotliVariantEncoder implements VariantEncoder {

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 11;

    private final Encoder.Parameters parameters;

    public BrotliVariantEncoder(int quality) {
        if (quality < MIN_QUALITY || quality > MAX_QUALITY) {
            throw new IllegalArgumentException("brotli quality must be 0-11: " + quality);
        }
        Brotli4jLoader.ensureAvailability();
        this.parameters = new Encoder.Parameters().setQuality(quality);
    }

    @Override
    public ContentEncoding encoding() {
        return ContentEncoding.BROTLI;
    }

    @Override
    public OutputStream wrap(OutputStream target) throws IOException {
        return new BrotliOutputStream(target, parameters);
    }
}

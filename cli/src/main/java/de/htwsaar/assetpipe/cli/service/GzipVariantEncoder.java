package de.htwsaar.assetpipe.cli.service;

import de.htwsaar.assetpipe.assets.delivery.ContentEncoding;
import java.io.IOException;
import java.io.OutputStream;
import java.util.zip.GZIPOutputStream;

public final class GzipVariantEncoder implements VariantEncoder {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 9;

    private final int level;

    public GzipVariantEncoder(int level) {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("gzip level must be 1-9: " + level);
        }
        this.level = level;
    }

    @Override
    public ContentEncoding encoding() {
        return ContentEncoding.GZIP;
    }

    @Override
    public OutputStream wrap(OutputStream target) throws IOException {
        return new GZIPOutputStream(target) {
            {
                def.setLevel(level);
            }
        };
    }
}

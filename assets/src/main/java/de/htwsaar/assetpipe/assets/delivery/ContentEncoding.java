package de.htwsaar.assetpipe.assets.delivery;

/**
 * Vorkomprimierte Varianten in Präferenzreihenfolge: Brotli vor gzip.
 */
public enum ContentEncoding {
    BROTLI("br", ".br"),
    GZIP("gzip", ".gz");

    private final String token;
    private final String extension;

    ContentEncoding(String token, String extension) {
        this.token = token;
        this.extension = extension;
    }

    /** Wert für {@code Content-Encoding} bzw. Token in {@code Accept-Encoding}. */
    public String token() {
        return token;
    }

    /** Dateiendung des Geschwisters, z. B. {@code .br}. */
    public String extension() {
        return extension;
    }
}

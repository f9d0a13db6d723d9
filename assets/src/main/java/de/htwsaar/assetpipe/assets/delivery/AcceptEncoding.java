package de.htwsaar.assetpipe.assets.delivery;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Parser für den {@code Accept-Encoding}-Header.
 *
 * <p>Tokens mit {@code q=0} gelten als abgelehnt; {@code *} deckt alle nicht explizit genannten
 * Codierungen ab.</p>
 */
public final class AcceptEncoding {

    private static final String WILDCARD = "*";

    private final Map<String, Double> weights;

    private AcceptEncoding(Map<String, Double> weights) {
        this.weights = weights;
    }

    public static AcceptEncoding parse(String header) {
        Map<String, Double> weights = new HashMap<>();
        if (header == null || header.isBlank()) {
            return new AcceptEncoding(weights);
        }
        for (String part : header.split(",")) {
            String[] pieces = part.split(";");
            String coding = pieces[0].trim().toLowerCase(Locale.ROOT);
            if (coding.isEmpty()) continue;
            double q = 1.0;
            for (int i = 1; i < pieces.length; i++) {
                String param = pieces[i].trim();
                if (param.length() > 2 && (param.startsWith("q=") || param.startsWith("Q="))) {
                    q = parseQuality(param.substring(2).trim());
                }
            }
            weights.merge(coding, q, Math::max);
        }
        return new AcceptEncoding(weights);
    }

    /**
     * @param coding Codierung, z. B. {@code br}
     * @return {@code true}, wenn der Client die Codierung mit {@code q > 0} akzeptiert
     */
    public boolean accepts(String coding) {
        Double q = weights.get(coding.toLowerCase(Locale.ROOT));
        if (q == null) q = weights.get(WILDCARD);
        return q != null && q > 0;
    }

    public boolean accepts(ContentEncoding encoding) {
        return accepts(encoding.token());
    }

    private static double parseQuality(String value) {
        try {
            double q = Double.parseDouble(value);
            return Double.isNaN(q) ? 0.0 : Math.max(0.0, Math.min(1.0, q));
        } catch (NumberFormatException e) {
            // unlesbarer Gewichtswert: Token nicht akzeptieren
            return 0.0;
        }
    }
}

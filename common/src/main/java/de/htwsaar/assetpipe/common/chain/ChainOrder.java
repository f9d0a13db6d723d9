package de.htwsaar.assetpipe.common.chain;

import org.springframework.core.Ordered;

/**
 * Reihenfolge der Middleware-Kette (außen nach innen).
 *
 * <p>Die Reihenfolge ist Teil des Vertrages: Real-IP muss vor allem laufen, was nach
 * Client-Adresse loggt oder limitiert, und das Limit folgt direkt darauf; der HTTPS-Redirect
 * liegt innerhalb von Real-IP, damit er {@code X-Forwarded-Proto} sieht; Recovery muss alles darunter umschließen; das Logging
 * umschließt den Deadline-Guard, damit Endstatus und Dauer erfasst werden; Kompression liegt
 * außerhalb des ETag-Filters, damit der ETag über den unkomprimierten Body gebildet wird.</p>
 */
public final class ChainOrder {

    private static final int BASE = Ordered.HIGHEST_PRECEDENCE + 100;

    public static final int REQUEST_ID = BASE;
    public static final int REAL_IP = BASE + 10;
    public static final int RATE_LIMIT = BASE + 20;
    public static final int HTTPS_REDIRECT = BASE + 30;
    public static final int RECOVERY = BASE + 40;
    public static final int REQUEST_LOGGING = BASE + 50;
    public static final int DEADLINE = BASE + 60;
    public static final int SECURITY_HEADERS = BASE + 70;
    public static final int COMPRESSION = BASE + 80;
    public static final int ETAG = BASE + 90;

    private ChainOrder() {}
}

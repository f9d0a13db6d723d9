package de.htwsaar.assetpipe.cli.service;

import de.htwsaar.assetpipe.assets.delivery.ContentEncoding;
import java.io.IOException;
import java.io.OutputStream;

/** Erzeugt eine komprimierte Geschwisterdatei ({@code .br} oder {@code .gz}). */
public interface VariantEncoder {

    ContentEncoding encoding();

    /**
     * Umhüllt den Ziel-Stream; Schließen des Rückgabewerts schließt auch {@code target}.
     */
    OutputStream wrap(OutputStream target) throws IOException;
}

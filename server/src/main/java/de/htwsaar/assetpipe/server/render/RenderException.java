package de.htwsaar.assetpipe.server.render;

/**
 * Rendern fehlgeschlagen und die Antwort war bereits committed, sodass kein 500 mehr gesendet
 * werden kann.
 */
public class RenderException extends RuntimeException {

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}

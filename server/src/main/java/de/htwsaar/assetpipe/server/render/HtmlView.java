package de.htwsaar.assetpipe.server.render;

import java.io.IOException;
import java.io.Writer;

/**
 * Ein HTML-View, der in einen gepufferten Writer rendert.
 */
@FunctionalInterface
public interface HtmlView {

    void render(ViewContext context, Writer out) throws IOException;
}

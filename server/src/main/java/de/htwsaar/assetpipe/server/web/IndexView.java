package de.htwsaar.assetpipe.server.web;

import de.htwsaar.assetpipe.server.render.HtmlView;
import de.htwsaar.assetpipe.server.render.ViewContext;
import java.io.IOException;
import java.io.Writer;
import org.springframework.web.util.HtmlUtils;

/**
 * Startseite: bindet Stylesheet und Script über versionierte URLs mit SRI ein; das Inline-Script
 * trägt die CSP-Nonce des Requests.
 */
class IndexView implements HtmlView {

    private final String stylesheet;
    private final String script;

    IndexView(String stylesheet, String script) {
        this.stylesheet = stylesheet;
        this.script = script;
    }

    @Override
    public void render(ViewContext ctx, Writer out) throws IOException {
        out.write("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n<meta charset=\"utf-8\">\n");
        out.write("<title>assetpipe</title>\n");
        out.write("<link rel=\"stylesheet\" href=\"" + attr(ctx.assetUrl(stylesheet)) + "\"");
        writeIntegrity(ctx, out, stylesheet);
        out.write(">\n</head>\n<body>\n");
        out.write("<main id=\"app\" data-request-id=\"" + attr(ctx.requestId()) + "\"></main>\n");
        out.write("<script src=\"" + attr(ctx.assetUrl(script)) + "\"");
        writeIntegrity(ctx, out, script);
        out.write("></script>\n");
        out.write("<script nonce=\"" + attr(ctx.cspNonce()) + "\">document.documentElement.dataset.ready = 'true';</script>\n");
        out.write("</body>\n</html>\n");
    }

    private static void writeIntegrity(ViewContext ctx, Writer out, String logicalPath) throws IOException {
        String sri = ctx.assetSri(logicalPath);
        if (!sri.isEmpty()) {
            out.write(" integrity=\"" + attr(sri) + "\" crossorigin=\"anonymous\"");
        }
    }

    private static String attr(String value) {
        return HtmlUtils.htmlEscape(value == null ? "" : value);
    }
}

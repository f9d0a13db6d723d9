package de.htwsaar.assetpipe.server.render;

import java.io.ByteArrayOutputStream;

/**
 * Wiederverwendbarer Byte-Puffer; kennt seine aktuelle Kapazität.
 */
final class RenderBuffer extends ByteArrayOutputStream {

    RenderBuffer(int initialCapacity) {
        super(initialCapacity);
    }

    synchronized int capacity() {
        return buf.length;
    }
}

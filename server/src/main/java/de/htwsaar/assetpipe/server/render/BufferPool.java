package de.htwsaar.assetpipe.server.render;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Begrenzter Pool wiederverwendbarer Render-Puffer.
 *
 * <p>Ist der Pool leer, wird ein neuer Puffer erzeugt; ist er voll, wird der zurückgegebene
 * Puffer verworfen. Puffer, die über {@code maxRetainedCapacity} gewachsen sind, kommen nicht
 * zurück in den Pool.</p>
 */
public class BufferPool {

    private final BlockingQueue<RenderBuffer> idle;
    private final int initialCapacity;
    private final int maxRetainedCapacity;

    public BufferPool(int maxPooled, int initialCapacity, int maxRetainedCapacity) {
        if (maxPooled <= 0) throw new IllegalArgumentException("maxPooled must be > 0");
        this.idle = new ArrayBlockingQueue<>(maxPooled);
        this.initialCapacity = initialCapacity;
        this.maxRetainedCapacity = maxRetainedCapacity;
    }

    RenderBuffer acquire() {
        RenderBuffer buffer = idle.poll();
        return buffer != null ? buffer : new RenderBuffer(initialCapacity);
    }

    /** Setzt den Puffer zurück und legt ihn, wenn möglich, in den Pool. */
    void release(RenderBuffer buffer) {
        if (buffer == null || buffer.capacity() > maxRetainedCapacity) return;
        buffer.reset();
        idle.offer(buffer);
    }

    public int idleCount() {
        return idle.size();
    }
}

package com.questrail.pvl.sink;

import java.nio.charset.StandardCharsets;

/**
 * LabelSink
 * -----------------------------------------------------------------------------
 * Append-only byte destination for encoded label text.
 *
 * <p>The encoder only ever appends. Buffering, flushing and backpressure are
 * the sink's business; the encoder never flushes, retries or rewinds.</p>
 *
 * <p>Implementations may be backed by a byte array, an
 * {@link java.io.OutputStream}, a Netty buffer, or a test harness.</p>
 */
public interface LabelSink
{
    /**
     * Append {@code bytes} to the sink.
     */
    void write(byte[] bytes);

    /**
     * Append {@code text} encoded as UTF-8.
     */
    default void write(String text)
    {
        write(text.getBytes(StandardCharsets.UTF_8));
    }
}

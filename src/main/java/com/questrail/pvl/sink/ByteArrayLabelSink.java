package com.questrail.pvl.sink;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * In-memory {@link LabelSink}.
 *
 * <p>Used as the private buffer when a caller needs all-or-nothing output:
 * encode into a fresh instance and adopt its bytes only on success.</p>
 */
public final class ByteArrayLabelSink implements LabelSink
{
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    @Override
    public void write(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        buffer.writeBytes(bytes);
    }

    public int size()
    {
        return buffer.size();
    }

    public byte[] toByteArray()
    {
        return buffer.toByteArray();
    }

    @Override
    public String toString()
    {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}

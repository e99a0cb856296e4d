package com.questrail.pvl.sink;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * {@link LabelSink} writing straight through to an {@link OutputStream}.
 *
 * <p>The stream is neither flushed nor closed by this sink. I/O failures are
 * rethrown as {@link UncheckedIOException}.</p>
 */
public final class OutputStreamLabelSink implements LabelSink
{
    private final OutputStream out;

    public OutputStreamLabelSink(OutputStream out)
    {
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public void write(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        try {
            out.write(bytes);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to write label bytes", e);
        }
    }
}

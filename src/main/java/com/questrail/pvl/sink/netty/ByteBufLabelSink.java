package com.questrail.pvl.sink.netty;

import com.questrail.pvl.sink.LabelSink;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;

import java.util.Objects;

/**
 * ByteBufLabelSink
 * =============================================================================
 * Netty-backed implementation of the {@link LabelSink} port.
 *
 * <h2>Netty containment rule</h2>
 * Netty types MUST NOT escape this package except through the constructor
 * argument supplied by the caller, who owns the buffer.
 *
 * <h2>Ownership</h2>
 * This sink never retains, releases or resets the buffer. It only appends at
 * the writer index; reference counting stays with the caller.
 */
public final class ByteBufLabelSink implements LabelSink
{
    private final ByteBuf buffer;

    public ByteBufLabelSink(ByteBuf buffer)
    {
        this.buffer = Objects.requireNonNull(buffer, "buffer");
    }

    @Override
    public void write(byte[] bytes)
    {
        Objects.requireNonNull(bytes, "bytes");
        buffer.writeBytes(bytes);
    }

    @Override
    public void write(String text)
    {
        // Avoids the intermediate byte[] for the common string path.
        ByteBufUtil.writeUtf8(buffer, text);
    }

    @Override
    public String toString()
    {
        return "ByteBufLabelSink[writerIndex=" + buffer.writerIndex() + "]";
    }
}

package com.questrail.pvl.codec.impl;

import com.questrail.pvl.sink.LabelSink;

import java.util.Objects;

/**
 * Call-scoped state threaded through the recursive block traversal.
 *
 * @param sink             destination for this call
 * @param assignmentColumn column every key is padded to before {@code " = "};
 *                         {@link #UNALIGNED} disables padding
 */
record BlockContext(LabelSink sink, int assignmentColumn)
{
    static final int UNALIGNED = 0;

    BlockContext
    {
        Objects.requireNonNull(sink, "sink");
        if (assignmentColumn < 0) {
            throw new IllegalArgumentException("assignmentColumn must be >= 0");
        }
    }
}

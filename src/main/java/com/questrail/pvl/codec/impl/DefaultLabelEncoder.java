package com.questrail.pvl.codec.impl;

import com.questrail.pvl.codec.LabelEncodeException;
import com.questrail.pvl.codec.LabelEncoder;
import com.questrail.pvl.config.LabelDialect;
import com.questrail.pvl.model.LabelMapping;
import com.questrail.pvl.sink.LabelSink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * DefaultLabelEncoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link LabelEncoder}.
 *
 * <p>One traversal serves every dialect; the {@link LabelDialect} handed to the
 * constructor supplies tokens, end-line style, indent unit, alignment policy
 * and the quoting collaborator.</p>
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>Compute the assignment column if the dialect aligns assignments</li>
 *   <li>Encode the top-level block at level 0</li>
 *   <li>Write the terminal token (no trailing newline)</li>
 * </ol>
 *
 * <p>Instances hold only immutable configuration and may be shared freely.</p>
 */
public final class DefaultLabelEncoder implements LabelEncoder
{
    private static final Logger log = LoggerFactory.getLogger(DefaultLabelEncoder.class);

    private final LabelDialect dialect;
    private final BlockEncoder blocks;

    public DefaultLabelEncoder(LabelDialect dialect)
    {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.blocks = new BlockEncoder(dialect, new LabelValueCodec(dialect.quoter()));
    }

    public LabelDialect dialect()
    {
        return dialect;
    }

    @Override
    public void encode(LabelMapping label, LabelSink sink)
    {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(sink, "sink");

        final int column = dialect.alignAssignments()
                ? AssignmentColumn.detect(label, dialect.indent())
                : BlockContext.UNALIGNED;

        log.debug("Encoding {} statements as {} (assignment column {})",
                label.size(), dialect.name(), column);

        try {
            blocks.encodeBlock(label, 0, new BlockContext(sink, column));
        }
        catch (LabelEncodeException e) {
            log.debug("{} encode aborted: {}", dialect.name(), e.getMessage());
            throw e;
        }

        sink.write(dialect.terminal());
    }

    @Override
    public String toString()
    {
        return "DefaultLabelEncoder[" + dialect.name() + "]";
    }
}

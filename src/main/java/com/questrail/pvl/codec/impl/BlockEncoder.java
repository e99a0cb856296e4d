package com.questrail.pvl.codec.impl;

import com.questrail.pvl.codec.LabelEncodeException;
import com.questrail.pvl.config.EndLineStyle;
import com.questrail.pvl.config.LabelDialect;
import com.questrail.pvl.model.LabelEntry;
import com.questrail.pvl.model.LabelMapping;
import com.questrail.pvl.model.LabelValue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * BlockEncoder
 * -----------------------------------------------------------------------------
 * Walks a {@link LabelMapping} and writes one line per statement.
 *
 * <p>Each entry is dispatched to exactly one of:</p>
 * <ul>
 *   <li>group block: {@code <beginGroup> = NAME}, children at level + 1,
 *       then the group end line</li>
 *   <li>object block: same, with the object tokens</li>
 *   <li>assignment: {@code KEY = <value text>}</li>
 * </ul>
 *
 * <p>End lines follow the dialect's {@link EndLineStyle}: either another
 * assignment repeating the block name, or the bare end token.</p>
 *
 * <p>Indentation is {@code level} copies of the dialect's indent unit and is
 * derived from {@code level} on every line. When the call carries an
 * assignment column, the indented key slot of every assignment line
 * (including begin and repeated-name end lines) is right-padded to it.</p>
 */
final class BlockEncoder
{
    private static final Logger log = LoggerFactory.getLogger(BlockEncoder.class);

    static final String ASSIGNMENT = " = ";
    static final String NEWLINE = "\n";

    private final LabelDialect dialect;
    private final LabelValueCodec values;

    BlockEncoder(LabelDialect dialect, LabelValueCodec values)
    {
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.values = Objects.requireNonNull(values, "values");
    }

    void encodeBlock(LabelMapping block, int level, BlockContext ctx)
    {
        for (LabelEntry entry : block.entries()) {
            encodeStatement(entry.key(), entry.value(), level, ctx);
        }
    }

    private void encodeStatement(String key, LabelValue value, int level, BlockContext ctx)
    {
        if (value instanceof LabelMapping nested) {
            if (nested.isGroup()) {
                encodeNested(key, nested, dialect.beginGroup(), dialect.endGroup(), level, ctx);
            } else {
                encodeNested(key, nested, dialect.beginObject(), dialect.endObject(), level, ctx);
            }
            return;
        }

        final String valueText;
        try {
            valueText = values.encodeValue(value);
        }
        catch (LabelEncodeException e) {
            log.debug("Value of key {} at level {} can not be encoded: {}", key, level, e.getMessage());
            throw e;
        }
        writeAssignment(key, valueText, level, ctx);
    }

    private void encodeNested(String name,
                              LabelMapping block,
                              String beginToken,
                              String endToken,
                              int level,
                              BlockContext ctx)
    {
        writeAssignment(beginToken, name, level, ctx);
        encodeBlock(block, level + 1, ctx);

        if (dialect.endLineStyle() == EndLineStyle.BARE) {
            ctx.sink().write(indent(level) + endToken + NEWLINE);
        } else {
            writeAssignment(endToken, name, level, ctx);
        }
    }

    private void writeAssignment(String key, String valueText, int level, BlockContext ctx)
    {
        String indentedKey = indent(level) + key;

        StringBuilder line = new StringBuilder(
                Math.max(indentedKey.length(), ctx.assignmentColumn()) + valueText.length() + 4);
        line.append(indentedKey);
        for (int w = AssignmentColumn.width(indentedKey); w < ctx.assignmentColumn(); w++) {
            line.append(' ');
        }
        line.append(ASSIGNMENT).append(valueText).append(NEWLINE);

        ctx.sink().write(line.toString());
    }

    private String indent(int level)
    {
        return dialect.indent().repeat(level);
    }
}

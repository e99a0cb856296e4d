package com.questrail.pvl.codec.impl;

import com.questrail.pvl.model.LabelEntry;
import com.questrail.pvl.model.LabelMapping;

/**
 * AssignmentColumn
 * -----------------------------------------------------------------------------
 * PDS3 column aligner.
 *
 * <p>PDS3 labels start every assignment token of the document in one shared
 * column. That column is the widest indented key anywhere in the tree, where
 * a key at depth {@code d} is {@code d * indentWidth + width(key)} wide. A long
 * key deep in the tree therefore widens the column for shallow keys too.</p>
 *
 * <p>Widths are counted in code points. An empty mapping contributes nothing.</p>
 */
final class AssignmentColumn
{
    private AssignmentColumn() {}

    /**
     * Computes the shared assignment column for {@code root}.
     *
     * @param root   top-level mapping (depth 0)
     * @param indent the indent unit repeated per nesting level
     */
    static int detect(LabelMapping root, String indent)
    {
        return detect(root, 0, width(indent));
    }

    private static int detect(LabelMapping block, int indentWidth, int unitWidth)
    {
        int column = 0;
        for (LabelEntry entry : block.entries()) {
            int length = indentWidth + width(entry.key());

            if (entry.value() instanceof LabelMapping nested) {
                length = Math.max(length, detect(nested, indentWidth + unitWidth, unitWidth));
            }

            column = Math.max(column, length);
        }
        return column;
    }

    static int width(String text)
    {
        return text.codePointCount(0, text.length());
    }
}

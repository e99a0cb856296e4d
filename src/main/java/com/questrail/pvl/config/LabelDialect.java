package com.questrail.pvl.config;

import com.questrail.pvl.codec.quote.GrammarTextQuoter;
import com.questrail.pvl.codec.quote.TextQuoter;

import java.util.Objects;

/**
 * LabelDialect
 * -----------------------------------------------------------------------------
 * Immutable token table and formatting policy for one label dialect.
 *
 * <p>A dialect is pure data. Encoders look tokens up here instead of being
 * subclassed per dialect, so one traversal serves every surface syntax.</p>
 *
 * <h2>Built-in dialects</h2>
 * <pre>
 *   dialect  group / end              object / end               terminal  end line
 *   DEFAULT  BEGIN_GROUP / END_GROUP  BEGIN_OBJECT / END_OBJECT  END       REPEAT_NAME
 *   CUBE     Group / End_Group        Object / End_Object        End       BARE
 *   PDS3     GROUP / END              OBJECT / END               END       REPEAT_NAME, aligned
 * </pre>
 *
 * <p><strong>PDS3 note:</strong> the same {@code END} token closes both groups
 * and objects. Output is only re-parseable by a decoder that pairs begin and
 * end lines with a stack; the encoder does not try to disambiguate.</p>
 *
 * @param alignAssignments when true, every {@code =} in the document starts at
 *                         one shared column computed from the longest indented key
 * @param indent           the indent unit repeated once per nesting level
 * @param quoter           quoting collaborator for text values under this grammar
 */
public record LabelDialect(
        String name,
        String beginGroup,
        String endGroup,
        String beginObject,
        String endObject,
        String terminal,
        EndLineStyle endLineStyle,
        boolean alignAssignments,
        String indent,
        TextQuoter quoter
) {
    public static final String DEFAULT_INDENT = "  ";

    public static final LabelDialect DEFAULT = new LabelDialect(
            "PVL",
            "BEGIN_GROUP", "END_GROUP",
            "BEGIN_OBJECT", "END_OBJECT",
            "END",
            EndLineStyle.REPEAT_NAME,
            false,
            DEFAULT_INDENT,
            GrammarTextQuoter.pvl());

    public static final LabelDialect CUBE = new LabelDialect(
            "ISIS",
            "Group", "End_Group",
            "Object", "End_Object",
            "End",
            EndLineStyle.BARE,
            false,
            DEFAULT_INDENT,
            GrammarTextQuoter.pvl());

    public static final LabelDialect PDS3 = new LabelDialect(
            "PDS3",
            "GROUP", "END",
            "OBJECT", "END",
            "END",
            EndLineStyle.REPEAT_NAME,
            true,
            DEFAULT_INDENT,
            GrammarTextQuoter.odl());

    public LabelDialect {
        Objects.requireNonNull(name, "name");
        requireToken(beginGroup, "beginGroup");
        requireToken(endGroup, "endGroup");
        requireToken(beginObject, "beginObject");
        requireToken(endObject, "endObject");
        requireToken(terminal, "terminal");
        Objects.requireNonNull(endLineStyle, "endLineStyle");
        Objects.requireNonNull(indent, "indent");
        Objects.requireNonNull(quoter, "quoter");
        if (!indent.isBlank()) {
            throw new IllegalArgumentException("indent must consist of whitespace only");
        }
    }

    private static void requireToken(String token, String field) {
        Objects.requireNonNull(token, field);
        if (token.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }

    /**
     * Returns a builder pre-populated with this dialect's settings.
     */
    public Builder toBuilder() {
        return new Builder()
                .withName(name)
                .withGroupTokens(beginGroup, endGroup)
                .withObjectTokens(beginObject, endObject)
                .withTerminal(terminal)
                .withEndLineStyle(endLineStyle)
                .withAlignedAssignments(alignAssignments)
                .withIndent(indent)
                .withQuoter(quoter);
    }

    /**
     * Returns a builder whose defaults equal {@link #DEFAULT}.
     */
    public static Builder builder() {
        return DEFAULT.toBuilder();
    }

    public static final class Builder {
        private String name;
        private String beginGroup;
        private String endGroup;
        private String beginObject;
        private String endObject;
        private String terminal;
        private EndLineStyle endLineStyle;
        private boolean alignAssignments;
        private String indent;
        private TextQuoter quoter;

        private Builder() {}

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withGroupTokens(String begin, String end) {
            this.beginGroup = begin;
            this.endGroup = end;
            return this;
        }

        public Builder withObjectTokens(String begin, String end) {
            this.beginObject = begin;
            this.endObject = end;
            return this;
        }

        public Builder withTerminal(String terminal) {
            this.terminal = terminal;
            return this;
        }

        public Builder withEndLineStyle(EndLineStyle endLineStyle) {
            this.endLineStyle = endLineStyle;
            return this;
        }

        public Builder withAlignedAssignments(boolean alignAssignments) {
            this.alignAssignments = alignAssignments;
            return this;
        }

        public Builder withIndent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder withQuoter(TextQuoter quoter) {
            this.quoter = quoter;
            return this;
        }

        public LabelDialect build() {
            return new LabelDialect(name, beginGroup, endGroup, beginObject, endObject,
                    terminal, endLineStyle, alignAssignments, indent, quoter);
        }
    }
}

package com.questrail.pvl.validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ValidationReport
 * -----------------------------------------------------------------------------
 * Renders {@link FileValidation} results as plain text.
 *
 * <p>A single file is rendered as one line per profile:</p>
 * <pre>
 *   PDS3 |     Loads     |     Encodes
 *   ISIS | does NOT load |
 * </pre>
 *
 * <p>Several files are rendered as a table with one column per profile, each
 * cell holding {@code L} / {@code No L} and {@code E} / {@code No E}:</p>
 * <pre>
 *   ------+-----------+----------
 *   File  |   PDS3    |   ISIS
 *   ------+-----------+----------
 *   a.lbl |  L    E   |  L   No E
 * </pre>
 *
 * <p>The file column is at least as wide as its {@code File} header. The first
 * cell of every line is left-justified; the others are centered,
 * with the odd padding space on the right. Lines are joined with {@code \n}
 * and there is no trailing newline.</p>
 */
public final class ValidationReport
{
    static final String SEPARATOR = " | ";

    private static final String FILE_HEADER = "File";

    private static final String LOADS = "Loads";
    private static final String NOT_LOADS = "does NOT load";
    private static final String ENCODES = "Encodes";
    private static final String NOT_ENCODES = "does NOT encode";

    private static final String SHORT_LOADS = "L";
    private static final String SHORT_NOT_LOADS = "No L";
    private static final String SHORT_ENCODES = "E";
    private static final String SHORT_NOT_ENCODES = "No E";

    private ValidationReport() {}

    /**
     * Renders {@code results} for the given profile order.
     *
     * @throws IllegalArgumentException if there are no results, or the first
     *         result's profile count differs from {@code profiles}
     */
    public static String render(List<FileValidation> results, List<String> profiles)
    {
        Objects.requireNonNull(results, "results");
        Objects.requireNonNull(profiles, "profiles");

        if (results.isEmpty()) {
            throw new IllegalArgumentException("Nothing to report");
        }

        int recorded = results.get(0).outcomes().size();
        if (recorded != profiles.size()) {
            throw new IllegalArgumentException("The number of recorded profiles (" + recorded
                    + ") and the number of report profiles (" + profiles.size() + ") differ");
        }

        if (results.size() > 1) {
            return renderMany(results, profiles);
        }
        return renderSingle(results.get(0), profiles);
    }

    static String renderSingle(FileValidation result, List<String> profiles)
    {
        int col1w = maxWidth(profiles);
        int col2w = maxWidth(List.of(LOADS, NOT_LOADS));
        int col3w = maxWidth(List.of(ENCODES, NOT_ENCODES, ""));
        List<Integer> widths = List.of(col1w, col2w, col3w);

        List<String> lines = new ArrayList<>();
        for (String profile : profiles) {
            ProfileOutcome outcome = result.outcome(profile);
            String loads = outcome.loaded() ? LOADS : NOT_LOADS;
            String encodes = !outcome.loaded() ? "" : outcome.encoded() ? ENCODES : NOT_ENCODES;
            lines.add(buildLine(List.of(profile, loads, encodes), widths));
        }
        return String.join("\n", lines);
    }

    static String renderMany(List<FileValidation> results, List<String> profiles)
    {
        List<String> firstColumn = new ArrayList<>();
        firstColumn.add(FILE_HEADER);
        results.forEach(r -> firstColumn.add(r.file()));
        int col1w = maxWidth(firstColumn);
        int col2w = maxWidth(List.of(SHORT_LOADS, SHORT_NOT_LOADS));
        int col3w = maxWidth(List.of(SHORT_ENCODES, SHORT_NOT_ENCODES, ""));
        int profileWidth = col2w + col3w + 1;

        List<String> header = new ArrayList<>();
        header.add(FILE_HEADER);
        header.addAll(profiles);

        List<Integer> widths = new ArrayList<>();
        widths.add(col1w);
        widths.addAll(Collections.nCopies(profiles.size(), profileWidth));

        List<String> rule = new ArrayList<>();
        rule.add(" ".repeat(col1w));
        rule.addAll(Collections.nCopies(profiles.size(), " ".repeat(profileWidth)));

        String ruleLine = buildLine(rule, widths).replace('|', '+').replace(' ', '-');

        List<String> lines = new ArrayList<>();
        lines.add(ruleLine);
        lines.add(buildLine(header, widths));
        lines.add(ruleLine);

        for (FileValidation result : results) {
            List<String> cells = new ArrayList<>();
            cells.add(result.file());
            for (String profile : profiles) {
                ProfileOutcome outcome = result.outcome(profile);
                String loads = outcome.loaded() ? SHORT_LOADS : SHORT_NOT_LOADS;
                String encodes = !outcome.loaded() ? "" : outcome.encoded() ? SHORT_ENCODES : SHORT_NOT_ENCODES;
                cells.add(center(loads, col2w) + " " + center(encodes, col3w));
            }
            lines.add(buildLine(cells, widths));
        }

        return String.join("\n", lines);
    }

    /**
     * Joins {@code elements} with {@code " | "}, left-justifying the first to
     * its width and centering the rest.
     */
    static String buildLine(List<String> elements, List<Integer> widths)
    {
        if (elements.size() != widths.size()) {
            throw new IllegalArgumentException("Each element needs exactly one width");
        }

        List<String> cells = new ArrayList<>(elements.size());
        for (int i = 0; i < elements.size(); i++) {
            String element = elements.get(i);
            int width = widths.get(i);
            cells.add(i == 0 ? leftJustify(element, width) : center(element, width));
        }
        return String.join(SEPARATOR, cells);
    }

    static String leftJustify(String text, int width)
    {
        int pad = width - text.length();
        return pad <= 0 ? text : text + " ".repeat(pad);
    }

    static String center(String text, int width)
    {
        int pad = width - text.length();
        if (pad <= 0) {
            return text;
        }
        int left = pad / 2;
        return " ".repeat(left) + text + " ".repeat(pad - left);
    }

    private static int maxWidth(List<String> values)
    {
        int max = 0;
        for (String v : values) {
            max = Math.max(max, v.length());
        }
        return max;
    }
}
